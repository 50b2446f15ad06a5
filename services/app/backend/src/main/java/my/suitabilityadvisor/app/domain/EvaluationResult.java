package my.suitabilityadvisor.app.domain;

import java.util.List;

public record EvaluationResult(
		String productId,
		boolean eligible,
		Decision decision,
		double score,
		List<String> reasons,
		String summary,
		String customerExplanation,
		String advisorExplanation
) {
	public static final String PENDING_EXPLANATION = "Pending AI generation...";

	public EvaluationResult {
		reasons = reasons == null ? List.of() : List.copyOf(reasons);
	}

	public boolean explanationPending() {
		return PENDING_EXPLANATION.equals(customerExplanation) || PENDING_EXPLANATION.equals(advisorExplanation);
	}

	public EvaluationResult withExplanations(String customer, String advisor) {
		return new EvaluationResult(productId, eligible, decision, score, reasons, summary, customer, advisor);
	}
}
