package my.suitabilityadvisor.app.domain;

public record ManualFields(
		CustomerKind customerType,
		String name,
		String citizenship,
		String countryOfResidence,
		Goal goal,
		RiskTolerance riskTolerance
) {
	public static ManualFields defaults() {
		return new ManualFields(CustomerKind.INDIVIDUAL, null, null, null, Goal.CREDIT_CARD, RiskTolerance.MEDIUM);
	}

	public ManualFields merge(ManualFields update) {
		if (update == null) {
			return this;
		}
		return new ManualFields(
				update.customerType() != null ? update.customerType() : customerType,
				update.name() != null ? update.name() : name,
				update.citizenship() != null ? update.citizenship() : citizenship,
				update.countryOfResidence() != null ? update.countryOfResidence() : countryOfResidence,
				update.goal() != null ? update.goal() : goal,
				update.riskTolerance() != null ? update.riskTolerance() : riskTolerance
		);
	}

	public CustomerKind customerTypeOrDefault() {
		return customerType == null ? CustomerKind.INDIVIDUAL : customerType;
	}
}
