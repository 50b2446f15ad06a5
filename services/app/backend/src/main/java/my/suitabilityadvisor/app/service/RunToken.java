package my.suitabilityadvisor.app.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies one analysis run. A token stays valid until another run starts, the run is cancelled or
 * the session is cleared; writes from a stale token are discarded by {@link SuitabilitySession}.
 */
public final class RunToken {
	private final long runId;
	private final AtomicLong currentRunId;

	RunToken(long runId, AtomicLong currentRunId) {
		this.runId = runId;
		this.currentRunId = currentRunId;
	}

	public long runId() {
		return runId;
	}

	public boolean isCurrent() {
		return currentRunId.get() == runId;
	}

	@Override
	public String toString() {
		return "RunToken{" + runId + (isCurrent() ? "" : ", stale") + "}";
	}
}
