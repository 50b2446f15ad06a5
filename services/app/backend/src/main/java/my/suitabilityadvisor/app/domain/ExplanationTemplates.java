package my.suitabilityadvisor.app.domain;

public record ExplanationTemplates(String approved, String review, String declined) {
	public String forDecision(Decision decision) {
		if (decision == null) {
			return declined;
		}
		return switch (decision) {
			case APPROVE -> approved;
			case REVIEW -> review;
			case DECLINE -> declined;
		};
	}
}
