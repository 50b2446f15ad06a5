package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Explanation;
import my.suitabilityadvisor.app.domain.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class TemplateExplanationGenerator implements ExplanationGenerator {
	@Override
	public Explanation generate(CustomerProfile profile, Product product, EvaluationResult evaluation) {
		String template = product.explanationTemplates().forDecision(evaluation.decision());
		String customer = template == null || template.isBlank()
				? evaluation.summary()
				: render(template, profile, product);
		return new Explanation(
				customer == null || customer.isBlank() ? Explanation.MISSING_TEXT : customer,
				advisorText(evaluation));
	}

	static String render(String template, CustomerProfile profile, Product product) {
		String dscr = profile == null || profile.dscr() == null
				? "N/A"
				: BigDecimal.valueOf(profile.dscr()).setScale(2, RoundingMode.HALF_UP).toPlainString();
		return template
				.replace("{{productName}}", product.name() == null ? "" : product.name())
				.replace("{{dscr}}", dscr);
	}

	private String advisorText(EvaluationResult evaluation) {
		StringBuilder text = new StringBuilder();
		text.append(evaluation.decision()).append(" (score ").append(evaluation.score()).append(").");
		if (evaluation.summary() != null) {
			text.append(' ').append(evaluation.summary());
		}
		if (!evaluation.reasons().isEmpty()) {
			text.append(" Reasons: ").append(String.join("; ", evaluation.reasons())).append('.');
		}
		return text.toString();
	}
}
