package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.catalog.ProductCatalog;
import my.suitabilityadvisor.app.config.AppProperties;
import my.suitabilityadvisor.app.domain.AnalysisStage;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.DocumentValidation;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Explanation;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.domain.RunState;
import my.suitabilityadvisor.app.rules.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one analysis: validate documents, extract the profile, score the catalog and generate
 * explanations in parallel. Every commit goes through {@link SuitabilitySession#commit} with the run's
 * token, so a superseded or cancelled run never writes.
 */
@Service
public class AnalysisPipelineService {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisPipelineService.class);
	static final int PROGRESS_VALIDATED = 30;
	static final int PROGRESS_EXTRACTED = 60;
	static final int PROGRESS_SCORED = 70;
	static final int PROGRESS_EXPLANATION_SPAN = 25;
	static final int PROGRESS_EXPLANATION_CAP = 95;
	private static final long QUEUE_POLL_MILLIS = 200;

	private final SuitabilitySession session;
	private final DocumentValidator documentValidator;
	private final ProfileExtractor profileExtractor;
	private final ExplanationGenerator explanationGenerator;
	private final ProductCatalog catalog;
	private final ScoringEngine scoringEngine;
	private final AnalysisErrorClassifier errorClassifier;
	private final ExecutorService pipelineExecutor;
	private final ExecutorService explanationExecutor;
	private final Duration collaboratorTimeout;

	public AnalysisPipelineService(SuitabilitySession session,
								   DocumentValidator documentValidator,
								   ProfileExtractor profileExtractor,
								   ExplanationGenerator explanationGenerator,
								   ProductCatalog catalog,
								   ScoringEngine scoringEngine,
								   AnalysisErrorClassifier errorClassifier,
								   @Qualifier("analysisPipelineExecutor") ExecutorService pipelineExecutor,
								   @Qualifier("analysisExplanationExecutor") ExecutorService explanationExecutor,
								   AppProperties properties) {
		this.session = session;
		this.documentValidator = documentValidator;
		this.profileExtractor = profileExtractor;
		this.explanationGenerator = explanationGenerator;
		this.catalog = catalog;
		this.scoringEngine = scoringEngine;
		this.errorClassifier = errorClassifier;
		this.pipelineExecutor = pipelineExecutor;
		this.explanationExecutor = explanationExecutor;
		this.collaboratorTimeout = Duration.ofSeconds(properties.analysisOrDefault().collaboratorTimeoutSecondsOrDefault());
	}

	/**
	 * Starts a run in the background and returns its initial state. Any run still in flight is superseded.
	 */
	public RunState start() {
		return submit().state();
	}

	/**
	 * Like {@link #start()}, but also exposes the completion of the background execution.
	 */
	public SubmittedRun submit() {
		StartedRun run = session.beginRun();
		logger.info("Analysis run {} started ({} document(s), customerType={})",
				run.token().runId(), run.documents().size(), run.manualFields().customerTypeOrDefault());
		CompletableFuture<RunState> completion = CompletableFuture.supplyAsync(() -> {
			execute(run);
			return session.runState();
		}, pipelineExecutor);
		return new SubmittedRun(run.state(), completion);
	}

	public boolean cancel() {
		boolean cancelled = session.cancelRun();
		if (cancelled) {
			logger.info("Analysis run cancelled");
		}
		return cancelled;
	}

	public RunState current() {
		return session.runState();
	}

	void execute(StartedRun run) {
		RunToken token = run.token();
		try {
			ManualFields fields = run.manualFields();
			advance(token, update -> update.stage(AnalysisStage.VALIDATING_DOCUMENTS));
			List<DocumentValidation> validations = callWithTimeout("Document validation",
					() -> documentValidator.validate(run.documents(), fields.customerTypeOrDefault(), fields.name()));
			ensureCurrent(token);
			List<String> issues = collectIssues(validations, fields.name());
			if (!issues.isEmpty()) {
				throw new DocumentValidationException(issues);
			}
			advance(token, update -> update.progress(PROGRESS_VALIDATED).stage(AnalysisStage.EXTRACTING_PROFILE));

			CustomerProfile extracted = callWithTimeout("Profile extraction",
					() -> profileExtractor.extract(run.documents(), fields));
			CustomerProfile profile = mergeDeclaredFields(extracted, fields);
			advance(token, update -> update.profile(profile).progress(PROGRESS_EXTRACTED).stage(AnalysisStage.SCORING_PRODUCTS));

			List<Product> products = catalog.productsFor(profile.customerType());
			List<EvaluationResult> scored = new ArrayList<>();
			for (Product product : products) {
				scored.add(scoringEngine.evaluate(profile, product));
			}
			advance(token, update -> update.evaluations(scored).progress(PROGRESS_SCORED)
					.stage(AnalysisStage.GENERATING_EXPLANATIONS));
			logger.info("Run {} scored {} product(s) for {}", token.runId(), scored.size(), profile.customerType());

			List<EvaluationResult> explained = explain(token, profile, products, scored);
			advance(token, update -> update.evaluations(explained).succeed());
			logger.info("Analysis run {} completed", token.runId());
		} catch (StaleRunException ex) {
			logger.info("Analysis run {} superseded or cancelled; discarding its results", token.runId());
		} catch (RuntimeException ex) {
			failWithReference(token, ex);
		}
	}

	private List<EvaluationResult> explain(RunToken token,
										   CustomerProfile profile,
										   List<Product> products,
										   List<EvaluationResult> scored) {
		int total = scored.size();
		if (total == 0) {
			return List.of();
		}
		Map<String, Product> productsById = new LinkedHashMap<>();
		for (Product product : products) {
			productsById.put(product.id(), product);
		}
		Map<String, EvaluationResult> explained = new ConcurrentHashMap<>();
		AtomicInteger completed = new AtomicInteger();
		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		for (EvaluationResult evaluation : scored) {
			Product product = productsById.get(evaluation.productId());
			CompletableFuture<Void> task = CompletableFuture
					.supplyAsync(() -> explainWithTimeout(token, profile, product, evaluation), pipelineExecutor)
					.thenAccept(explanation -> {
						explained.put(evaluation.productId(), withExplanation(evaluation, explanation));
						int done = completed.incrementAndGet();
						int progress = Math.min(PROGRESS_SCORED + (done * PROGRESS_EXPLANATION_SPAN) / total,
								PROGRESS_EXPLANATION_CAP);
						session.commit(token, update -> update.progress(progress));
					});
			tasks.add(task);
		}
		CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
		ensureCurrent(token);
		List<EvaluationResult> results = new ArrayList<>(total);
		for (EvaluationResult evaluation : scored) {
			results.add(explained.getOrDefault(evaluation.productId(), withExplanation(evaluation, Explanation.fallback())));
		}
		return results;
	}

	/**
	 * Generates one explanation on the explanation pool. The timeout counts from the moment the call starts,
	 * not from submission, and a timed-out call is interrupted so it frees its worker.
	 */
	private Explanation explainWithTimeout(RunToken token,
										   CustomerProfile profile,
										   Product product,
										   EvaluationResult evaluation) {
		CompletableFuture<Long> started = new CompletableFuture<>();
		Future<Explanation> future;
		try {
			future = explanationExecutor.submit(() -> {
				started.complete(System.nanoTime());
				return explanationGenerator.generate(profile, product, evaluation);
			});
		} catch (RejectedExecutionException ex) {
			logger.warn("Explanation for product {} rejected in run {}: {}", evaluation.productId(), token.runId(), ex.toString());
			return Explanation.fallback();
		}
		try {
			Long startedAt = null;
			while (startedAt == null) {
				if (future.isDone() || !token.isCurrent()) {
					break;
				}
				try {
					startedAt = started.get(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
				} catch (TimeoutException stillQueued) {
					// waiting for a free explanation worker
				}
			}
			if (startedAt == null && !future.isDone()) {
				future.cancel(true);
				return Explanation.fallback();
			}
			long deadline = (startedAt == null ? System.nanoTime() : startedAt) + collaboratorTimeout.toNanos();
			return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			logger.warn("Explanation for product {} timed out after {}s in run {}",
					evaluation.productId(), collaboratorTimeout.toSeconds(), token.runId());
		} catch (ExecutionException ex) {
			logger.warn("Explanation for product {} failed in run {}: {}",
					evaluation.productId(), token.runId(), String.valueOf(ex.getCause()));
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
		}
		return Explanation.fallback();
	}

	static EvaluationResult withExplanation(EvaluationResult evaluation, Explanation explanation) {
		String customer = explanation == null ? null : explanation.customer();
		String advisor = explanation == null ? null : explanation.advisor();
		return evaluation.withExplanations(
				usable(customer) ? customer : Explanation.GENERATION_FAILED,
				usable(advisor) ? advisor : Explanation.GENERATION_FAILED);
	}

	private static boolean usable(String text) {
		return text != null && !text.isBlank() && !EvaluationResult.PENDING_EXPLANATION.equals(text);
	}

	static List<String> collectIssues(List<DocumentValidation> validations, String declaredName) {
		List<String> issues = new ArrayList<>();
		if (validations == null) {
			return issues;
		}
		for (DocumentValidation validation : validations) {
			if (validation.passed()) {
				continue;
			}
			if (!validation.issues().isEmpty()) {
				issues.addAll(validation.issues());
				continue;
			}
			if (!validation.nameMatchesDeclared()) {
				issues.add("Name mismatch in " + validation.slotKey() + ": Expected '" + declaredName
						+ "', found '" + validation.detectedName() + "'.");
			}
			if (!validation.typeMatchesSlot()) {
				issues.add("Type mismatch in " + validation.slotKey() + ": Expected " + validation.expectedDocType()
						+ ", found " + validation.detectedDocType() + ".");
			}
		}
		return issues;
	}

	static CustomerProfile mergeDeclaredFields(CustomerProfile extracted, ManualFields fields) {
		CustomerProfile base = extracted == null ? CustomerProfile.initial(fields.customerTypeOrDefault()) : extracted;
		return base.toBuilder()
				.customerType(fields.customerType() != null ? fields.customerType() : base.customerType())
				.name(present(fields.name()) ? fields.name() : base.name())
				.citizenship(present(fields.citizenship()) ? fields.citizenship() : base.citizenship())
				.countryOfResidence(present(fields.countryOfResidence()) ? fields.countryOfResidence() : base.countryOfResidence())
				.goal(fields.goal() != null ? fields.goal() : base.goal())
				.riskTolerance(fields.riskTolerance() != null ? fields.riskTolerance() : base.riskTolerance())
				.build();
	}

	private static boolean present(String value) {
		return value != null && !value.isBlank();
	}

	private <T> T callWithTimeout(String operation, Callable<T> call) {
		Future<T> future = pipelineExecutor.submit(call);
		try {
			return future.get(collaboratorTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException ex) {
			future.cancel(true);
			throw new CollaboratorTimeoutException(operation, collaboratorTimeout);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException(operation + " failed", cause);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new IllegalStateException(operation + " interrupted", ex);
		}
	}

	private void advance(RunToken token, Consumer<SuitabilitySession.RunUpdate> mutation) {
		if (!session.commit(token, mutation)) {
			throw new StaleRunException();
		}
	}

	private static void ensureCurrent(RunToken token) {
		if (!token.isCurrent()) {
			throw new StaleRunException();
		}
	}

	private void failWithReference(RunToken token, RuntimeException ex) {
		String message = errorClassifier.classify(ex);
		String reference = "AN-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		if (ex instanceof DocumentValidationException) {
			logger.warn("Analysis run {} rejected documents (ref {}): {}", token.runId(), reference, ex.getMessage());
		} else {
			logger.error("Analysis run {} failed (ref {})", token.runId(), reference, ex);
		}
		if (!session.commit(token, update -> update.fail(message))) {
			logger.info("Analysis run {} failed after being superseded; error not recorded", token.runId());
		}
	}

	/**
	 * The run is no longer current. Unwinds the pipeline without recording anything.
	 */
	private static final class StaleRunException extends RuntimeException {
		StaleRunException() {
			super(null, null, false, false);
		}
	}

	public record SubmittedRun(RunState state, CompletableFuture<RunState> completion) {
	}
}
