package my.suitabilityadvisor.app.rules;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.Decision;
import my.suitabilityadvisor.app.domain.DecisionThresholds;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.domain.ProductConstraints;
import my.suitabilityadvisor.app.domain.ScoringWeights;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic product suitability scoring. Eligibility comes from the product's hard constraints,
 * the score from its weighted metrics; the two are computed independently and combined into a
 * {@link Decision}.
 */
public class ScoringEngine {
	public static final String REASON_BORDERLINE = "Borderline Score";
	public static final String REASON_LOW_SCORE = "Low Score";
	public static final String SUMMARY_APPROVE = "Meets all criteria with a strong score.";
	public static final String SUMMARY_REVIEW = "Meets minimums but score indicates moderate risk.";
	public static final String SUMMARY_LOW_SCORE = "Score below approval threshold.";
	public static final String SUMMARY_FAILED_PREFIX = "Failed requirements: ";

	public EvaluationResult evaluate(CustomerProfile profile, Product product) {
		CustomerProfile subject = profile == null ? CustomerProfile.initial() : profile;
		List<String> reasons = new ArrayList<>(checkConstraints(subject, product.constraints()));
		boolean eligible = reasons.isEmpty();
		double score = weightedScore(subject, product.scoring().weights());

		Decision decision;
		String summary;
		if (!eligible) {
			decision = Decision.DECLINE;
			summary = SUMMARY_FAILED_PREFIX + reasons.get(0);
		} else {
			DecisionThresholds thresholds = product.scoring().thresholds();
			if (score >= thresholds.approve()) {
				decision = Decision.APPROVE;
				summary = SUMMARY_APPROVE;
			} else if (score >= thresholds.review()) {
				decision = Decision.REVIEW;
				summary = SUMMARY_REVIEW;
				reasons.add(REASON_BORDERLINE);
			} else {
				decision = Decision.DECLINE;
				summary = SUMMARY_LOW_SCORE;
				reasons.add(REASON_LOW_SCORE);
			}
		}

		return new EvaluationResult(
				product.id(),
				eligible,
				decision,
				round(score),
				reasons,
				summary,
				EvaluationResult.PENDING_EXPLANATION,
				EvaluationResult.PENDING_EXPLANATION
		);
	}

	List<String> checkConstraints(CustomerProfile profile, ProductConstraints constraints) {
		List<String> violations = new ArrayList<>();
		for (HardConstraint constraint : HardConstraint.values()) {
			if (constraint.isViolated(constraints, profile)) {
				violations.add(constraint.reason(constraints));
			}
		}
		return violations;
	}

	double weightedScore(CustomerProfile profile, ScoringWeights weights) {
		double totalScore = 0.0d;
		double totalWeight = 0.0d;
		for (ScoringMetric metric : ScoringMetric.values()) {
			double weight = metric.weightOf(weights);
			if (weight <= 0.0d) {
				continue;
			}
			double value = MissingValuePolicy.forScoring(metric.rawValueOf(profile), metric);
			totalScore += metric.normalize(value) * weight;
			totalWeight += weight;
		}
		return totalWeight > 0.0d ? totalScore / totalWeight : 0.0d;
	}

	private double round(double score) {
		return BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}
}
