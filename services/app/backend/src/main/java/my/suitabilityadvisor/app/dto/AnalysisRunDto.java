package my.suitabilityadvisor.app.dto;

import my.suitabilityadvisor.app.domain.AnalysisStage;
import my.suitabilityadvisor.app.domain.RunState;
import my.suitabilityadvisor.app.domain.RunStatus;

import java.time.Instant;

public record AnalysisRunDto(
		long runId,
		RunStatus status,
		AnalysisStage stage,
		int progress,
		String error,
		Instant lastActivity
) {
	public static AnalysisRunDto from(RunState state) {
		return new AnalysisRunDto(state.runId(), state.status(), state.stage(), state.progress(), state.error(),
				state.lastActivity());
	}
}
