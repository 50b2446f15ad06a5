package my.suitabilityadvisor.app.dto;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.ManualFields;

import java.util.List;

public record SessionStateDto(
		int step,
		ManualFields manualFields,
		List<DocumentSummaryDto> documents,
		CustomerProfile profile,
		List<EvaluationResult> evaluations,
		AnalysisRunDto run,
		List<String> missingRequirements
) {
}
