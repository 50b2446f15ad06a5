package my.suitabilityadvisor.app.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {
	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/**
	 * Runs pipelines and every blocking wait on a collaborator. Unbounded
	 * because a superseded run may still be waiting on a collaborator while the next one starts.
	 */
	@Bean(name = "analysisPipelineExecutor", destroyMethod = "shutdownNow")
	public ExecutorService analysisPipelineExecutor() {
		return Executors.newCachedThreadPool(namedDaemonThreads("analysis-pipeline-"));
	}

	@Bean(name = "analysisExplanationExecutor", destroyMethod = "shutdownNow")
	public ExecutorService analysisExplanationExecutor(AppProperties properties) {
		int parallelism = properties.analysisOrDefault().explanationParallelismOrDefault();
		return Executors.newFixedThreadPool(parallelism, namedDaemonThreads("analysis-explain-"));
	}

	private static ThreadFactory namedDaemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
