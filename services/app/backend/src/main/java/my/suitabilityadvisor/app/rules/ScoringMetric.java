package my.suitabilityadvisor.app.rules;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.ScoringWeights;

import java.util.function.Function;

public enum ScoringMetric {
	DEBT_TO_INCOME(0.30d, 0.60d, false, ScoringWeights::debtToIncome, CustomerProfile::debtToIncomeRatio),
	DSCR(1.5d, 1.0d, true, ScoringWeights::dscr, CustomerProfile::dscr),
	CREDIT_UTILIZATION(0.30d, 0.90d, false, ScoringWeights::creditUtilization, CustomerProfile::totalCreditCardUtilization),
	BOUNCED_CHEQUES(0.0d, 3.0d, false, ScoringWeights::bouncedCheques, CustomerProfile::bouncedChequesLast12Months),
	LATE_PAYMENTS(0.0d, 3.0d, false, ScoringWeights::latePayments, CustomerProfile::latePaymentIncidentsLast12Months),
	// income and revenue levels stand in for stability
	INCOME_STABILITY(10000.0d, 2000.0d, true, ScoringWeights::incomeStability, CustomerProfile::monthlyIncome),
	REVENUE_STABILITY(50000.0d, 5000.0d, true, ScoringWeights::revenueStability, CustomerProfile::averageMonthlyRevenue);

	private final double good;
	private final double bad;
	private final boolean higherIsBetter;
	private final Function<ScoringWeights, Double> weight;
	private final Function<CustomerProfile, ? extends Number> rawValue;

	ScoringMetric(double good,
				  double bad,
				  boolean higherIsBetter,
				  Function<ScoringWeights, Double> weight,
				  Function<CustomerProfile, ? extends Number> rawValue) {
		this.good = good;
		this.bad = bad;
		this.higherIsBetter = higherIsBetter;
		this.weight = weight;
		this.rawValue = rawValue;
	}

	public double good() {
		return good;
	}

	public double bad() {
		return bad;
	}

	public boolean higherIsBetter() {
		return higherIsBetter;
	}

	public double weightOf(ScoringWeights weights) {
		if (weights == null) {
			return 0.0d;
		}
		Double value = weight.apply(weights);
		return value == null ? 0.0d : value;
	}

	public Number rawValueOf(CustomerProfile profile) {
		return rawValue.apply(profile);
	}

	/**
	 * Linear ramp clamped to [0,1]: the good anchor maps to 1, the bad anchor to 0.
	 */
	public double normalize(double value) {
		if (higherIsBetter) {
			if (value >= good) {
				return 1.0d;
			}
			if (value <= bad) {
				return 0.0d;
			}
			return (value - bad) / (good - bad);
		}
		if (value <= good) {
			return 1.0d;
		}
		if (value >= bad) {
			return 0.0d;
		}
		return (bad - value) / (bad - good);
	}
}
