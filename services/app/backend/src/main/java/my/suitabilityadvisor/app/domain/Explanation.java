package my.suitabilityadvisor.app.domain;

public record Explanation(String customer, String advisor) {
	public static final String GENERATION_FAILED = "Could not generate explanation.";
	public static final String MISSING_TEXT = "Explanation generation failed.";

	public static Explanation fallback() {
		return new Explanation(GENERATION_FAILED, GENERATION_FAILED);
	}
}
