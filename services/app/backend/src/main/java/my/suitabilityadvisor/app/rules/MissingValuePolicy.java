package my.suitabilityadvisor.app.rules;

/**
 * Single place that decides how an unknown profile value is read.
 * <p>
 * Hard constraints read an unknown as {@code 0}; weighted scoring reads it as the metric's "bad"
 * anchor. The asymmetry is part of the scoring rules and must be kept in sync between both passes.
 * A present {@code 0} is a known value; NaN and infinities are unknown.
 */
public final class MissingValuePolicy {
	private MissingValuePolicy() {
	}

	public static double forConstraint(Number value) {
		return isKnown(value) ? value.doubleValue() : 0.0d;
	}

	public static double forScoring(Number value, ScoringMetric metric) {
		return isKnown(value) ? value.doubleValue() : metric.bad();
	}

	static boolean isKnown(Number value) {
		return value != null && Double.isFinite(value.doubleValue());
	}
}
