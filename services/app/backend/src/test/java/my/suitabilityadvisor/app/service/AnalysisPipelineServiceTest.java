package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.catalog.ProductCatalog;
import my.suitabilityadvisor.app.catalog.ProductCatalogLoader;
import my.suitabilityadvisor.app.config.AppProperties;
import my.suitabilityadvisor.app.domain.AnalysisStage;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.DocumentValidation;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Explanation;
import my.suitabilityadvisor.app.domain.Goal;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.domain.RiskTolerance;
import my.suitabilityadvisor.app.domain.RunState;
import my.suitabilityadvisor.app.domain.RunStatus;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.llm.LlmRequestException;
import my.suitabilityadvisor.app.rules.ScoringEngine;
import my.suitabilityadvisor.app.session.InMemorySessionStateStore;
import my.suitabilityadvisor.app.session.SessionSnapshot;
import my.suitabilityadvisor.app.session.SessionSnapshotCodec;
import my.suitabilityadvisor.app.session.SessionStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisPipelineServiceTest {
	private static final ManualFields JANE = new ManualFields(CustomerKind.INDIVIDUAL, "Jane Doe", "DE", "AE",
			Goal.CREDIT_CARD, RiskTolerance.MEDIUM);
	private static final ProductCatalog CATALOG = new ProductCatalogLoader()
			.load(new DefaultResourceLoader(), ProductCatalogLoader.DEFAULT_LOCATION);

	private final DocumentValidator documentValidator = mock(DocumentValidator.class);
	private final ProfileExtractor profileExtractor = mock(ProfileExtractor.class);
	private final ExplanationGenerator explanationGenerator = mock(ExplanationGenerator.class);
	private final CountDownLatch release = new CountDownLatch(1);
	private ExecutorService pipelineExecutor;
	private ExecutorService explanationExecutor;

	@BeforeEach
	void setUp() {
		pipelineExecutor = Executors.newCachedThreadPool();
		explanationExecutor = Executors.newFixedThreadPool(2);
		when(documentValidator.validate(anyList(), any(), any()))
				.thenAnswer(invocation -> passing(invocation.getArgument(0)));
		when(profileExtractor.extract(anyList(), any())).thenReturn(CustomerProfile.builder()
				.customerType(CustomerKind.INDIVIDUAL)
				.name("J. Doe")
				.age(34)
				.monthlyIncome(5200.0)
				.debtToIncomeRatio(0.2)
				.build());
		when(explanationGenerator.generate(any(), any(), any())).thenAnswer(invocation -> {
			Product product = invocation.getArgument(1);
			return new Explanation("customer " + product.id(), "advisor " + product.id());
		});
	}

	@AfterEach
	void tearDown() {
		release.countDown();
		pipelineExecutor.shutdownNow();
		explanationExecutor.shutdownNow();
	}

	@Test
	void completesAllStagesWithDeclaredFieldsWinning() throws Exception {
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 5);

		RunState finalState = service.submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.SUCCESS);
		assertThat(finalState.stage()).isEqualTo(AnalysisStage.COMPLETED);
		assertThat(finalState.progress()).isEqualTo(100);
		assertThat(finalState.error()).isNull();
		SessionSnapshot snapshot = session.snapshot();
		assertThat(snapshot.profile().name()).isEqualTo("Jane Doe");
		assertThat(snapshot.profile().citizenship()).isEqualTo("DE");
		assertThat(snapshot.profile().goal()).isEqualTo(Goal.CREDIT_CARD);
		assertThat(snapshot.profile().monthlyIncome()).isEqualTo(5200.0);
		assertThat(snapshot.evaluations()).extracting(EvaluationResult::productId)
				.containsExactly("prod_cc_001", "prod_pl_001");
		assertThat(snapshot.evaluations()).noneMatch(EvaluationResult::explanationPending);
		assertThat(snapshot.evaluations().get(0).customerExplanation()).isEqualTo("customer prod_cc_001");
		assertThat(snapshot.evaluations().get(1).advisorExplanation()).isEqualTo("advisor prod_pl_001");
	}

	@Test
	void failingExplanationFallsBackWithoutFailingTheRun() throws Exception {
		doAnswer(invocation -> {
			Product product = invocation.getArgument(1);
			if (product.id().equals("prod_pl_001")) {
				throw new IllegalStateException("model unavailable");
			}
			return new Explanation("customer " + product.id(), "advisor " + product.id());
		}).when(explanationGenerator).generate(any(), any(), any());
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 5);

		RunState finalState = service.submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.SUCCESS);
		List<EvaluationResult> evaluations = session.snapshot().evaluations();
		assertThat(evaluations.get(0).customerExplanation()).isEqualTo("customer prod_cc_001");
		assertThat(evaluations.get(1).customerExplanation()).isEqualTo(Explanation.GENERATION_FAILED);
		assertThat(evaluations.get(1).advisorExplanation()).isEqualTo(Explanation.GENERATION_FAILED);
	}

	@Test
	void blankExplanationTextIsReplaced() throws Exception {
		doReturn(new Explanation(" ", null)).when(explanationGenerator).generate(any(), any(), any());
		SuitabilitySession session = sessionWithIntake(memoryStore());

		service(session, CATALOG, 5).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(session.snapshot().evaluations())
				.allMatch(evaluation -> evaluation.customerExplanation().equals(Explanation.GENERATION_FAILED)
						&& evaluation.advisorExplanation().equals(Explanation.GENERATION_FAILED));
	}

	@Test
	void documentMismatchFailsBeforeExtraction() throws Exception {
		when(documentValidator.validate(anyList(), any(), any())).thenReturn(List.of(
				new DocumentValidation("PAYSLIP", "PAYSLIP", "Jane Doe", "ID_DOCUMENT", true, false, List.of())));
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 5);

		RunState finalState = service.submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.FAILED);
		assertThat(finalState.stage()).isEqualTo(AnalysisStage.VALIDATING_DOCUMENTS);
		assertThat(finalState.error()).isEqualTo(
				"Document Validation Failed:\n• Type mismatch in PAYSLIP: Expected PAYSLIP, found ID_DOCUMENT.");
		verify(profileExtractor, never()).extract(anyList(), any());
		assertThat(session.snapshot().profile()).isEqualTo(CustomerProfile.initial(CustomerKind.INDIVIDUAL));
		assertThat(session.snapshot().evaluations()).isEmpty();
	}

	@Test
	void collaboratorIssueTextIsPreferred() throws Exception {
		when(documentValidator.validate(anyList(), any(), any())).thenReturn(List.of(
				new DocumentValidation("ID_DOCUMENT", "ID_DOCUMENT", "John Roe", "ID_DOCUMENT", false, true,
						List.of("ID belongs to John Roe")),
				new DocumentValidation("PAYSLIP", "PAYSLIP", "Jane Doe", "PAYSLIP", true, true, List.of())));
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, CATALOG, 5).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.error()).isEqualTo("Document Validation Failed:\n• ID belongs to John Roe");
	}

	@Test
	void unauthorizedCollaboratorMapsToApiKeyMessage() throws Exception {
		when(profileExtractor.extract(anyList(), any()))
				.thenThrow(new LlmRequestException("Unauthorized", 401, false, null));
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, CATALOG, 5).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.FAILED);
		assertThat(finalState.error()).isEqualTo(AnalysisErrorClassifier.INVALID_API_KEY);
		assertThat(finalState.stage()).isEqualTo(AnalysisStage.EXTRACTING_PROFILE);
		assertThat(finalState.progress()).isEqualTo(AnalysisPipelineService.PROGRESS_VALIDATED);
	}

	@Test
	void hungCollaboratorTimesOut() throws Exception {
		CountDownLatch interrupted = new CountDownLatch(1);
		when(profileExtractor.extract(anyList(), any())).thenAnswer(invocation -> {
			try {
				release.await(10, TimeUnit.SECONDS);
			} catch (InterruptedException ex) {
				interrupted.countDown();
				throw ex;
			}
			return CustomerProfile.initial();
		});
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, CATALOG, 1).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.FAILED);
		assertThat(finalState.error()).isEqualTo(AnalysisErrorClassifier.SERVER_ERROR);
		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void hungExplanationIsInterruptedAndFallsBack() throws Exception {
		CountDownLatch interrupted = new CountDownLatch(2);
		doAnswer(invocation -> {
			try {
				release.await(10, TimeUnit.SECONDS);
			} catch (InterruptedException ex) {
				interrupted.countDown();
				throw ex;
			}
			return new Explanation("c", "a");
		}).when(explanationGenerator).generate(any(), any(), any());
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, CATALOG, 1).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.SUCCESS);
		assertThat(session.snapshot().evaluations()).hasSize(2)
				.allMatch(evaluation -> evaluation.customerExplanation().equals(Explanation.GENERATION_FAILED));
		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void queuedExplanationTimeoutStartsWhenItRuns() throws Exception {
		explanationExecutor.shutdownNow();
		explanationExecutor = Executors.newSingleThreadExecutor();
		doAnswer(invocation -> {
			Thread.sleep(700);
			Product product = invocation.getArgument(1);
			return new Explanation("customer " + product.id(), "advisor " + product.id());
		}).when(explanationGenerator).generate(any(), any(), any());
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, CATALOG, 1).submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.SUCCESS);
		assertThat(session.snapshot().evaluations()).extracting(EvaluationResult::customerExplanation)
				.containsExactly("customer prod_cc_001", "customer prod_pl_001");
	}

	@Test
	void newerRunSupersedesOlderRun() throws Exception {
		CountDownLatch firstEntered = new CountDownLatch(1);
		AtomicInteger calls = new AtomicInteger();
		when(documentValidator.validate(anyList(), any(), any())).thenAnswer(invocation -> {
			if (calls.incrementAndGet() == 1) {
				firstEntered.countDown();
				release.await(10, TimeUnit.SECONDS);
			}
			return passing(invocation.getArgument(0));
		});
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 10);

		AnalysisPipelineService.SubmittedRun first = service.submit();
		assertThat(firstEntered.await(10, TimeUnit.SECONDS)).isTrue();
		AnalysisPipelineService.SubmittedRun second = service.submit();
		RunState secondState = second.completion().get(10, TimeUnit.SECONDS);
		release.countDown();
		first.completion().get(10, TimeUnit.SECONDS);

		assertThat(second.state().runId()).isGreaterThan(first.state().runId());
		RunState current = service.current();
		assertThat(current.runId()).isEqualTo(second.state().runId());
		assertThat(current.status()).isEqualTo(RunStatus.SUCCESS);
		assertThat(current).isEqualTo(secondState);
		verify(profileExtractor, times(1)).extract(anyList(), any());
	}

	@Test
	void cancelledRunLeavesNoResults() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		when(profileExtractor.extract(anyList(), any())).thenAnswer(invocation -> {
			entered.countDown();
			release.await(10, TimeUnit.SECONDS);
			return CustomerProfile.builder().monthlyIncome(9000.0).build();
		});
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 10);

		AnalysisPipelineService.SubmittedRun run = service.submit();
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
		assertThat(service.cancel()).isTrue();
		release.countDown();
		run.completion().get(10, TimeUnit.SECONDS);

		RunState state = service.current();
		assertThat(state.status()).isEqualTo(RunStatus.IDLE);
		assertThat(state.progress()).isZero();
		assertThat(state.stage()).isEqualTo(AnalysisStage.NONE);
		assertThat(session.snapshot().evaluations()).isEmpty();
		assertThat(session.snapshot().profile().monthlyIncome()).isNull();
		verify(explanationGenerator, never()).generate(any(), any(), any());
	}

	@Test
	void cancelWithoutRunDoesNothing() {
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 5);

		assertThat(service.cancel()).isFalse();
		assertThat(service.current().status()).isEqualTo(RunStatus.IDLE);
	}

	@Test
	void progressNeverMovesBackwards() throws Exception {
		RecordingStore store = new RecordingStore();
		SuitabilitySession session = sessionWithIntake(store);
		AnalysisPipelineService service = service(session, CATALOG, 5);

		service.submit().completion().get(10, TimeUnit.SECONDS);

		List<Integer> progress = new ArrayList<>();
		boolean started = false;
		for (SessionSnapshot snapshot : store.saved) {
			started = started || snapshot.status() == RunStatus.RUNNING;
			if (started) {
				progress.add(snapshot.progress());
			}
		}
		assertThat(progress).isSorted().contains(30, 60, 70).endsWith(100);
		assertThat(progress).filteredOn(value -> value > 70 && value < 100).allMatch(value -> value <= 95);
	}

	@Test
	void scoredResultsArePublishedBeforeExplanationsFinish() throws Exception {
		doAnswer(invocation -> {
			release.await(10, TimeUnit.SECONDS);
			return new Explanation("c", "a");
		}).when(explanationGenerator).generate(any(), any(), any());
		SuitabilitySession session = sessionWithIntake(memoryStore());
		AnalysisPipelineService service = service(session, CATALOG, 10);

		AnalysisPipelineService.SubmittedRun run = service.submit();
		awaitCondition(() -> session.runState().stage() == AnalysisStage.GENERATING_EXPLANATIONS);

		SessionSnapshot midway = session.snapshot();
		assertThat(midway.progress()).isEqualTo(AnalysisPipelineService.PROGRESS_SCORED);
		assertThat(midway.evaluations()).hasSize(2).allMatch(EvaluationResult::explanationPending);

		release.countDown();
		assertThat(run.completion().get(10, TimeUnit.SECONDS).status()).isEqualTo(RunStatus.SUCCESS);
	}

	@Test
	void emptyCatalogStillSucceeds() throws Exception {
		SuitabilitySession session = sessionWithIntake(memoryStore());

		RunState finalState = service(session, new ProductCatalog(List.of()), 5)
				.submit().completion().get(10, TimeUnit.SECONDS);

		assertThat(finalState.status()).isEqualTo(RunStatus.SUCCESS);
		assertThat(session.snapshot().evaluations()).isEmpty();
		verify(explanationGenerator, never()).generate(any(), any(), any());
	}

	@Test
	void smeRunScoresOnlySmeProducts() throws Exception {
		when(profileExtractor.extract(anyList(), any())).thenReturn(CustomerProfile.builder()
				.customerType(CustomerKind.SME)
				.businessAgeMonths(30)
				.averageMonthlyRevenue(20000.0)
				.bouncedChequesLast12Months(0)
				.build());
		SuitabilitySession session = new SuitabilitySession(memoryStore(), Clock.systemUTC());
		session.updateManualFields(new ManualFields(CustomerKind.SME, "Acme", null, "AE", Goal.SME_WORKING_CAPITAL, null));
		session.addDocuments(List.of(new UploadedDocument("bank.pdf", "application/pdf", new byte[] {1}, "SME_BANK_STATEMENT")));

		service(session, CATALOG, 5).submit().completion().get(10, TimeUnit.SECONDS);

		List<EvaluationResult> evaluations = session.snapshot().evaluations();
		assertThat(evaluations).extracting(EvaluationResult::productId).containsExactly("prod_sme_001", "prod_sme_002");
		assertThat(evaluations.get(0).eligible()).isFalse();
		assertThat(evaluations.get(0).reasons()).containsExactly("DSCR too low (<1.25)");
		assertThat(evaluations.get(1).eligible()).isTrue();
	}

	private AnalysisPipelineService service(SuitabilitySession session, ProductCatalog catalog, int timeoutSeconds) {
		AppProperties properties = new AppProperties(null, new AppProperties.Analysis(timeoutSeconds, 2), null);
		return new AnalysisPipelineService(session, documentValidator, profileExtractor, explanationGenerator, catalog,
				new ScoringEngine(), new AnalysisErrorClassifier(), pipelineExecutor, explanationExecutor, properties);
	}

	private SuitabilitySession sessionWithIntake(SessionStateStore store) {
		SuitabilitySession session = new SuitabilitySession(store, Clock.systemUTC());
		session.updateManualFields(JANE);
		session.addDocuments(List.of(
				new UploadedDocument("statement.pdf", "application/pdf", new byte[] {1}, "INDIVIDUAL_BANK_STATEMENT"),
				new UploadedDocument("payslip.pdf", "application/pdf", new byte[] {2}, "PAYSLIP"),
				new UploadedDocument("passport.png", "image/png", new byte[] {3}, "ID_DOCUMENT")));
		return session;
	}

	private static SessionStateStore memoryStore() {
		return new InMemorySessionStateStore(new SessionSnapshotCodec(), 5 * 1024 * 1024);
	}

	private static List<DocumentValidation> passing(List<UploadedDocument> documents) {
		return new StubDocumentValidator().validate(documents, CustomerKind.INDIVIDUAL, "Jane Doe");
	}

	private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError("Condition not met within 10s");
			}
			Thread.sleep(10);
		}
	}

	private static final class RecordingStore implements SessionStateStore {
		private final List<SessionSnapshot> saved = new CopyOnWriteArrayList<>();

		@Override
		public void save(SessionSnapshot snapshot) {
			saved.add(snapshot);
		}

		@Override
		public Optional<SessionSnapshot> load() {
			return saved.isEmpty() ? Optional.empty() : Optional.of(saved.get(saved.size() - 1));
		}

		@Override
		public void clear() {
			saved.clear();
		}
	}
}
