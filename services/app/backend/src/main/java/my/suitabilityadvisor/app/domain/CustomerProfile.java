package my.suitabilityadvisor.app.domain;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record CustomerProfile(
		CustomerKind customerType,
		String name,
		Integer age,
		String citizenship,
		String countryOfResidence,
		Double monthlyIncome,
		Double monthlyExpenses,
		Double existingLoanEmi,
		Double totalCreditCardLimits,
		Double totalCreditCardUtilization,
		Integer businessAgeMonths,
		Double averageMonthlyRevenue,
		Double averageMonthlyNetProfit,
		Integer bouncedChequesLast12Months,
		Integer latePaymentIncidentsLast12Months,
		Double savingsBalanceEstimate,
		Double debtToIncomeRatio,
		Double dscr,
		List<String> riskFlags,
		Goal goal,
		RiskTolerance riskTolerance,
		String notes
) {
	public CustomerProfile {
		if (customerType == null) {
			customerType = CustomerKind.INDIVIDUAL;
		}
		riskFlags = riskFlags == null ? List.of() : List.copyOf(riskFlags);
	}

	public static CustomerProfile initial() {
		return initial(CustomerKind.INDIVIDUAL);
	}

	public static CustomerProfile initial(CustomerKind kind) {
		return builder().customerType(kind).build();
	}
}
