package my.suitabilityadvisor.app.config;

import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.NoopLlmClient;
import my.suitabilityadvisor.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm().openai();
		if (openai == null) {
			throw new IllegalStateException("app.llm.openai must be configured when app.llm.provider=openai");
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank()
				? "https://api.openai.com/v1"
				: openai.baseUrl();
		String model = openai.model();
		if (model == null || model.isBlank()) {
			model = "gpt-4.1-mini";
		}
		int connectTimeout = openai.connectTimeoutSeconds() == null ? 30 : Math.max(1, openai.connectTimeoutSeconds());
		int readTimeout = openai.readTimeoutSeconds() == null ? 180 : Math.max(1, openai.readTimeoutSeconds());
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, openai.apiKey(), model,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop); stub collaborators will be used.");
		return new NoopLlmClient();
	}
}
