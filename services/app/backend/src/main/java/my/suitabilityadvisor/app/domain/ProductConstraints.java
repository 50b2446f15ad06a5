package my.suitabilityadvisor.app.domain;

public record ProductConstraints(
		Integer minAge,
		Integer maxAge,
		Double minMonthlyIncome,
		Double minAverageMonthlyRevenue,
		Integer minBusinessAgeMonths,
		Double maxDebtToIncome,
		Double minDscr,
		Integer maxBouncedChequesLast12Months,
		Integer maxLatePaymentIncidentsLast12Months
) {
	public static ProductConstraints none() {
		return new ProductConstraints(null, null, null, null, null, null, null, null, null);
	}
}
