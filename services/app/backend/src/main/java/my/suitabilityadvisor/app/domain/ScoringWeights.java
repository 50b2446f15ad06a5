package my.suitabilityadvisor.app.domain;

public record ScoringWeights(
		Double incomeStability,
		Double revenueStability,
		Double debtToIncome,
		Double dscr,
		Double creditUtilization,
		Double bouncedCheques,
		Double latePayments
) {
	public static ScoringWeights none() {
		return new ScoringWeights(null, null, null, null, null, null, null);
	}
}
