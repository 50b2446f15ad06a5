package my.suitabilityadvisor.app.domain;

import java.time.Instant;

public record RunState(
		long runId,
		AnalysisStage stage,
		RunStatus status,
		int progress,
		String error,
		Instant lastActivity
) {
	public static RunState idle(Instant now) {
		return new RunState(0L, AnalysisStage.NONE, RunStatus.IDLE, 0, null, now);
	}

	public boolean isRunning() {
		return status == RunStatus.RUNNING;
	}
}
