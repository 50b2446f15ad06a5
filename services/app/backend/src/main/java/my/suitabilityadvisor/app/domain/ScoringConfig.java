package my.suitabilityadvisor.app.domain;

public record ScoringConfig(ScoringWeights weights, DecisionThresholds thresholds) {
	public ScoringConfig {
		if (weights == null) {
			weights = ScoringWeights.none();
		}
		if (thresholds == null) {
			thresholds = new DecisionThresholds(0.0d, 0.0d);
		}
	}

	public static ScoringConfig unweighted() {
		return new ScoringConfig(ScoringWeights.none(), new DecisionThresholds(0.0d, 0.0d));
	}
}
