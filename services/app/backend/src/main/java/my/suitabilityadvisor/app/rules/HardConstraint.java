package my.suitabilityadvisor.app.rules;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.ProductConstraints;

import java.math.BigDecimal;
import java.util.function.Function;

public enum HardConstraint {
	MIN_AGE(true, ProductConstraints::minAge, CustomerProfile::age, "Under minimum age (%s)"),
	MAX_AGE(false, ProductConstraints::maxAge, CustomerProfile::age, "Over maximum age (%s)"),
	MIN_MONTHLY_INCOME(true, ProductConstraints::minMonthlyIncome, CustomerProfile::monthlyIncome,
			"Income below minimum (%s)"),
	MIN_AVERAGE_MONTHLY_REVENUE(true, ProductConstraints::minAverageMonthlyRevenue,
			CustomerProfile::averageMonthlyRevenue, "Revenue below minimum (%s)"),
	MIN_BUSINESS_AGE_MONTHS(true, ProductConstraints::minBusinessAgeMonths, CustomerProfile::businessAgeMonths,
			"Business too young (<%s months)"),
	MAX_DEBT_TO_INCOME(false, ProductConstraints::maxDebtToIncome, CustomerProfile::debtToIncomeRatio,
			"DTI too high (>%s)"),
	MIN_DSCR(true, ProductConstraints::minDscr, CustomerProfile::dscr, "DSCR too low (<%s)"),
	MAX_BOUNCED_CHEQUES(false, ProductConstraints::maxBouncedChequesLast12Months,
			CustomerProfile::bouncedChequesLast12Months, "Too many bounced cheques (>%s)"),
	MAX_LATE_PAYMENTS(false, ProductConstraints::maxLatePaymentIncidentsLast12Months,
			CustomerProfile::latePaymentIncidentsLast12Months, "Too many late payments (>%s)");

	private final boolean minimum;
	private final Function<ProductConstraints, ? extends Number> limit;
	private final Function<CustomerProfile, ? extends Number> profileValue;
	private final String reasonTemplate;

	HardConstraint(boolean minimum,
				   Function<ProductConstraints, ? extends Number> limit,
				   Function<CustomerProfile, ? extends Number> profileValue,
				   String reasonTemplate) {
		this.minimum = minimum;
		this.limit = limit;
		this.profileValue = profileValue;
		this.reasonTemplate = reasonTemplate;
	}

	public Number limitOf(ProductConstraints constraints) {
		return constraints == null ? null : limit.apply(constraints);
	}

	/**
	 * @return {@code true} when the limit is defined and the profile value breaks it
	 */
	public boolean isViolated(ProductConstraints constraints, CustomerProfile profile) {
		Number limitValue = limitOf(constraints);
		if (limitValue == null) {
			return false;
		}
		double actual = MissingValuePolicy.forConstraint(profileValue.apply(profile));
		double bound = limitValue.doubleValue();
		return minimum ? actual < bound : actual > bound;
	}

	public String reason(ProductConstraints constraints) {
		return String.format(reasonTemplate, formatLimit(limitOf(constraints)));
	}

	static String formatLimit(Number value) {
		if (value == null) {
			return "";
		}
		if (value instanceof Integer || value instanceof Long) {
			return value.toString();
		}
		return BigDecimal.valueOf(value.doubleValue()).stripTrailingZeros().toPlainString();
	}
}
