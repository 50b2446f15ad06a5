package my.suitabilityadvisor.app.domain;

public enum AnalysisStage {
	NONE,
	VALIDATING_DOCUMENTS,
	EXTRACTING_PROFILE,
	SCORING_PRODUCTS,
	GENERATING_EXPLANATIONS,
	COMPLETED
}
