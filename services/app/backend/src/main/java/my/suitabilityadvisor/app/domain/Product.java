package my.suitabilityadvisor.app.domain;

public record Product(
		String id,
		String name,
		ProductCategory category,
		String description,
		TargetCustomerType targetCustomerType,
		ProductConstraints constraints,
		ScoringConfig scoring,
		ExplanationTemplates explanationTemplates
) {
	public Product {
		if (constraints == null) {
			constraints = ProductConstraints.none();
		}
		if (scoring == null) {
			scoring = ScoringConfig.unweighted();
		}
		if (explanationTemplates == null) {
			explanationTemplates = new ExplanationTemplates(null, null, null);
		}
	}

	public boolean targets(CustomerKind kind) {
		return targetCustomerType != null && targetCustomerType.includes(kind);
	}
}
