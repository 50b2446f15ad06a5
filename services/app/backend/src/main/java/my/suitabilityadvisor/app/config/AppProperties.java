package my.suitabilityadvisor.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Llm llm,
		Analysis analysis,
		Session session
) {
	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Analysis(
			Integer collaboratorTimeoutSeconds,
			Integer explanationParallelism
	) {
		public int collaboratorTimeoutSecondsOrDefault() {
			return collaboratorTimeoutSeconds == null || collaboratorTimeoutSeconds <= 0 ? 120 : collaboratorTimeoutSeconds;
		}

		public int explanationParallelismOrDefault() {
			return explanationParallelism == null || explanationParallelism <= 0 ? 4 : explanationParallelism;
		}
	}

	public record Session(
			String store,
			String filePath,
			Integer maxSnapshotBytes
	) {
		public int maxSnapshotBytesOrDefault() {
			return maxSnapshotBytes == null || maxSnapshotBytes <= 0 ? 5 * 1024 * 1024 : maxSnapshotBytes;
		}
	}

	public Analysis analysisOrDefault() {
		return analysis == null ? new Analysis(null, null) : analysis;
	}

	public Session sessionOrDefault() {
		return session == null ? new Session("memory", null, null) : session;
	}
}
