package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.AnalysisStage;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.RunState;
import my.suitabilityadvisor.app.domain.RunStatus;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.session.SessionSnapshot;
import my.suitabilityadvisor.app.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * The single advisory session. All state is guarded by one lock and every change is written through to
 * the {@link SessionStateStore}. Intake operations touch inputs only; run state and results change only
 * through {@link #commit(RunToken, Consumer)} with a current token.
 */
@Component
public class SuitabilitySession {
	private static final Logger logger = LoggerFactory.getLogger(SuitabilitySession.class);
	private static final long NO_RUN = 0L;

	private final Object lock = new Object();
	private final SessionStateStore store;
	private final Clock clock;
	private final AtomicLong runSequence = new AtomicLong();
	private final AtomicLong currentRunId = new AtomicLong(NO_RUN);

	private int step;
	private ManualFields manualFields;
	private List<UploadedDocument> documents;
	private CustomerProfile profile;
	private final Map<String, EvaluationResult> evaluations = new LinkedHashMap<>();
	private RunState run;

	public SuitabilitySession(SessionStateStore store, Clock clock) {
		this.store = store;
		this.clock = clock;
		synchronized (lock) {
			resetLocked();
			hydrateLocked();
		}
	}

	public SessionSnapshot snapshot() {
		synchronized (lock) {
			return snapshotLocked();
		}
	}

	public RunState runState() {
		synchronized (lock) {
			return run;
		}
	}

	public ManualFields manualFields() {
		synchronized (lock) {
			return manualFields;
		}
	}

	public List<UploadedDocument> documents() {
		synchronized (lock) {
			return List.copyOf(documents);
		}
	}

	/**
	 * Merges the update into the declared fields.
	 *
	 * @throws IllegalStateException when the update changes the customer kind while a run is in flight
	 */
	public ManualFields updateManualFields(ManualFields update) {
		synchronized (lock) {
			ManualFields merged = manualFields.merge(update);
			if (run.isRunning() && merged.customerTypeOrDefault() != manualFields.customerTypeOrDefault()) {
				throw new IllegalStateException("Customer type cannot change while an analysis is running");
			}
			manualFields = merged;
			touchLocked();
			persistLocked();
			return manualFields;
		}
	}

	public List<UploadedDocument> addDocuments(List<UploadedDocument> added) {
		synchronized (lock) {
			documents.addAll(added);
			touchLocked();
			persistLocked();
			return List.copyOf(documents);
		}
	}

	public boolean removeDocument(String name, String docType) {
		synchronized (lock) {
			boolean removed = documents.removeIf(document -> document.matches(name, docType));
			if (removed) {
				touchLocked();
				persistLocked();
			}
			return removed;
		}
	}

	public void setStep(int value) {
		synchronized (lock) {
			step = value;
			persistLocked();
		}
	}

	public void clear() {
		synchronized (lock) {
			currentRunId.set(NO_RUN);
			resetLocked();
			try {
				store.clear();
			} catch (RuntimeException ex) {
				logger.warn("Failed to clear stored session snapshot: {}", ex.getMessage());
			}
		}
	}

	/**
	 * Mints a new run, supersedes any in-flight run and resets results from earlier runs.
	 */
	public StartedRun beginRun() {
		synchronized (lock) {
			long runId = runSequence.incrementAndGet();
			currentRunId.set(runId);
			Instant now = clock.instant();
			run = new RunState(runId, AnalysisStage.NONE, RunStatus.RUNNING, 0, null, now);
			profile = CustomerProfile.initial(manualFields.customerTypeOrDefault());
			evaluations.clear();
			persistLocked();
			return new StartedRun(new RunToken(runId, currentRunId), manualFields, documents, run);
		}
	}

	/**
	 * Invalidates the current run and resets to idle. Does nothing unless a run is in flight.
	 */
	public boolean cancelRun() {
		synchronized (lock) {
			if (!run.isRunning()) {
				return false;
			}
			currentRunId.set(NO_RUN);
			run = new RunState(run.runId(), AnalysisStage.NONE, RunStatus.IDLE, 0, null, run.lastActivity());
			profile = CustomerProfile.initial(manualFields.customerTypeOrDefault());
			evaluations.clear();
			persistLocked();
			return true;
		}
	}

	/**
	 * Applies {@code mutation} if {@code token} is still current. The check and the write happen under
	 * the session lock.
	 *
	 * @return false when the token is stale and nothing was written
	 */
	public boolean commit(RunToken token, Consumer<RunUpdate> mutation) {
		synchronized (lock) {
			if (!token.isCurrent()) {
				return false;
			}
			mutation.accept(new RunUpdate());
			persistLocked();
			return true;
		}
	}

	/**
	 * Write access to run state and results, only handed out inside {@link #commit(RunToken, Consumer)}.
	 */
	public final class RunUpdate {
		private RunUpdate() {
		}

		public RunUpdate stage(AnalysisStage stage) {
			run = new RunState(run.runId(), stage, run.status(), run.progress(), run.error(), run.lastActivity());
			return this;
		}

		/**
		 * Raises progress; lower values are ignored and 100 is reserved for {@link #succeed()}.
		 */
		public RunUpdate progress(int value) {
			int next = Math.max(run.progress(), Math.min(value, 99));
			run = new RunState(run.runId(), run.stage(), run.status(), next, run.error(), run.lastActivity());
			return this;
		}

		public RunUpdate profile(CustomerProfile value) {
			profile = value;
			return this;
		}

		public RunUpdate evaluations(List<EvaluationResult> values) {
			evaluations.clear();
			for (EvaluationResult value : values) {
				evaluations.put(value.productId(), value);
			}
			return this;
		}

		public RunUpdate succeed() {
			run = new RunState(run.runId(), AnalysisStage.COMPLETED, RunStatus.SUCCESS, 100, null, clock.instant());
			return this;
		}

		public RunUpdate fail(String message) {
			run = new RunState(run.runId(), run.stage(), RunStatus.FAILED, run.progress(), message, run.lastActivity());
			return this;
		}
	}

	private SessionSnapshot snapshotLocked() {
		return new SessionSnapshot(
				step,
				manualFields,
				List.copyOf(documents),
				profile,
				List.copyOf(evaluations.values()),
				run.runId(),
				run.status(),
				run.stage(),
				run.progress(),
				run.error(),
				run.lastActivity());
	}

	private void resetLocked() {
		step = 1;
		manualFields = ManualFields.defaults();
		documents = new ArrayList<>();
		profile = CustomerProfile.initial();
		evaluations.clear();
		run = RunState.idle(clock.instant());
	}

	private void touchLocked() {
		run = new RunState(run.runId(), run.stage(), run.status(), run.progress(), run.error(), clock.instant());
	}

	private void persistLocked() {
		try {
			store.save(snapshotLocked());
		} catch (RuntimeException ex) {
			logger.warn("Failed to persist session snapshot: {}", ex.getMessage());
		}
	}

	private void hydrateLocked() {
		SessionSnapshot snapshot;
		try {
			Optional<SessionSnapshot> stored = store.load();
			if (stored.isEmpty()) {
				return;
			}
			snapshot = stored.get().withDefaults(clock.instant());
		} catch (RuntimeException ex) {
			logger.warn("Ignoring unreadable session snapshot: {}", ex.getMessage());
			return;
		}
		step = snapshot.step();
		manualFields = snapshot.manualFields();
		documents = new ArrayList<>(snapshot.documents());
		profile = snapshot.profile();
		for (EvaluationResult evaluation : snapshot.evaluations()) {
			evaluations.put(evaluation.productId(), evaluation);
		}
		runSequence.set(snapshot.runId());
		if (snapshot.status() == RunStatus.RUNNING) {
			// the run did not survive the restart
			profile = CustomerProfile.initial(manualFields.customerTypeOrDefault());
			evaluations.clear();
			run = new RunState(snapshot.runId(), AnalysisStage.NONE, RunStatus.IDLE, 0, null, snapshot.lastActivity());
		} else {
			run = new RunState(snapshot.runId(), snapshot.stage(), snapshot.status(), snapshot.progress(),
					snapshot.error(), snapshot.lastActivity());
		}
		logger.info("Restored session snapshot (step={}, documents={}, evaluations={}, status={})",
				step, documents.size(), evaluations.size(), run.status());
	}
}
