package my.suitabilityadvisor.app.rules;

import my.suitabilityadvisor.app.domain.DecisionThresholds;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.domain.ScoringWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ProductValidator {

	public List<String> validate(Product product) {
		List<String> errors = new ArrayList<>();
		if (product == null) {
			errors.add("Product is empty");
			return errors;
		}
		if (product.id() == null || product.id().isBlank()) {
			errors.add("id is required");
		}
		if (product.name() == null || product.name().isBlank()) {
			errors.add("name is required");
		}
		if (product.category() == null) {
			errors.add("category is required");
		}
		if (product.targetCustomerType() == null) {
			errors.add("target_customer_type is required");
		}
		ScoringWeights weights = product.scoring().weights();
		for (ScoringMetric metric : ScoringMetric.values()) {
			if (metric.weightOf(weights) < 0.0d) {
				errors.add("scoring.weights." + metric.name().toLowerCase(Locale.ROOT) + " must not be negative");
			}
		}
		DecisionThresholds thresholds = product.scoring().thresholds();
		if (thresholds.review() < 0.0d) {
			errors.add("scoring.thresholds.review must be >= 0");
		}
		if (thresholds.approve() < thresholds.review()) {
			errors.add("scoring.thresholds.approve must be >= review");
		}
		return errors;
	}
}
