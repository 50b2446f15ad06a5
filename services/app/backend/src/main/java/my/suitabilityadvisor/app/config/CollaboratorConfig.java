package my.suitabilityadvisor.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.suitabilityadvisor.app.catalog.ProductCatalogLoader;
import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.NoopLlmClient;
import my.suitabilityadvisor.app.service.DocumentValidator;
import my.suitabilityadvisor.app.service.ExplanationGenerator;
import my.suitabilityadvisor.app.service.LlmDocumentValidator;
import my.suitabilityadvisor.app.service.LlmExplanationGenerator;
import my.suitabilityadvisor.app.service.LlmProductDraftGenerator;
import my.suitabilityadvisor.app.service.LlmProfileExtractor;
import my.suitabilityadvisor.app.service.ProductDraftGenerator;
import my.suitabilityadvisor.app.service.ProfileExtractor;
import my.suitabilityadvisor.app.service.StubDocumentValidator;
import my.suitabilityadvisor.app.service.StubProfileExtractor;
import my.suitabilityadvisor.app.service.TemplateExplanationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CollaboratorConfig {
	private static final Logger logger = LoggerFactory.getLogger(CollaboratorConfig.class);

	@Bean
	@ConditionalOnMissingBean(DocumentValidator.class)
	public DocumentValidator documentValidator(LlmClient llmClient, ObjectMapper objectMapper) {
		if (llmClient instanceof NoopLlmClient) {
			logger.info("Document validation uses the accept-all stub.");
			return new StubDocumentValidator();
		}
		return new LlmDocumentValidator(llmClient, objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(ProfileExtractor.class)
	public ProfileExtractor profileExtractor(LlmClient llmClient, ObjectMapper objectMapper) {
		if (llmClient instanceof NoopLlmClient) {
			logger.info("Profile extraction uses the declared-fields stub.");
			return new StubProfileExtractor();
		}
		return new LlmProfileExtractor(llmClient, objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(ExplanationGenerator.class)
	public ExplanationGenerator explanationGenerator(LlmClient llmClient, ObjectMapper objectMapper) {
		if (llmClient instanceof NoopLlmClient) {
			return new TemplateExplanationGenerator();
		}
		return new LlmExplanationGenerator(llmClient, objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(ProductDraftGenerator.class)
	public ProductDraftGenerator productDraftGenerator(LlmClient llmClient, ProductCatalogLoader catalogLoader,
														ObjectMapper objectMapper) {
		return new LlmProductDraftGenerator(llmClient, catalogLoader, objectMapper);
	}
}
