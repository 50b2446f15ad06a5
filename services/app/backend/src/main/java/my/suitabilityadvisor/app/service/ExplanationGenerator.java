package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Explanation;
import my.suitabilityadvisor.app.domain.Product;

/**
 * Produces the customer-facing and advisor-facing texts for one evaluation. Implementations return
 * {@link Explanation#fallback()} instead of throwing when generation fails.
 */
public interface ExplanationGenerator {
	Explanation generate(CustomerProfile profile, Product product, EvaluationResult evaluation);
}
