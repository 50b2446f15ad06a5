package my.suitabilityadvisor.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.Explanation;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.LlmResponse;
import my.suitabilityadvisor.app.service.util.LlmJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class LlmExplanationGenerator implements ExplanationGenerator {
	private static final Logger logger = LoggerFactory.getLogger(LlmExplanationGenerator.class);
	private static final String INVALID_OUTPUT = "invalid_explanation_output";
	private static final String RESPONSE_SCHEMA = """
			{
			  "type": "object",
			  "additionalProperties": false,
			  "required": ["customer","advisor"],
			  "properties": {
			    "customer": { "type": "string" },
			    "advisor": { "type": "string" }
			  }
			}
			""";

	private final LlmClient llmClient;
	private final ObjectMapper objectMapper;
	private final Map<String, Object> responseSchema;
	private final JsonSchema outputSchema;

	public LlmExplanationGenerator(LlmClient llmClient, ObjectMapper objectMapper) {
		this.llmClient = llmClient;
		this.objectMapper = objectMapper;
		this.responseSchema = LlmJson.readSchema(objectMapper, RESPONSE_SCHEMA, "explanation response");
		this.outputSchema = LlmJson.compileSchema(objectMapper, RESPONSE_SCHEMA, "explanation response");
	}

	@Override
	public Explanation generate(CustomerProfile profile, Product product, EvaluationResult evaluation) {
		try {
			LlmResponse response = llmClient.runJsonPrompt(buildPrompt(profile, product, evaluation),
					"suitability_explanation", responseSchema);
			JsonNode root = LlmJson.readObject(objectMapper, response.output(), INVALID_OUTPUT);
			LlmJson.requireSchemaMatch(outputSchema, root, INVALID_OUTPUT, "Explanation");
			String customer = LlmJson.textOrNull(root, "customer");
			String advisor = LlmJson.textOrNull(root, "advisor");
			return new Explanation(
					customer == null ? Explanation.MISSING_TEXT : customer,
					advisor == null ? Explanation.MISSING_TEXT : advisor);
		} catch (RuntimeException ex) {
			logger.warn("Explanation generation failed for product {}: {}", product.id(), ex.getMessage());
			return Explanation.fallback();
		}
	}

	private String buildPrompt(CustomerProfile profile, Product product, EvaluationResult evaluation) {
		return """
				You are a bank relationship manager. Write explanations for a product suitability assessment.

				Context:
				- Product: %s (%s)
				- Decision: %s
				- Reasons: %s
				- Score: %s
				- Customer profile summary: Income %s, DTI %s, Risk Flags: %s

				Return a JSON object with two keys:
				1. "customer": a polite, simple explanation addressed to the customer. No jargon. If declined, be constructive.
				2. "advisor": a technical explanation for the bank officer, referencing specific metrics (DTI, DSCR, etc.) and risk factors.

				Do not promise approval. Use phrases like "appears suitable", "preliminary assessment", "subject to verification".
				""".formatted(
				product.name(),
				product.description(),
				evaluation.decision(),
				String.join(", ", evaluation.reasons()),
				evaluation.score(),
				profile.monthlyIncome(),
				profile.debtToIncomeRatio(),
				String.join(", ", profile.riskFlags()));
	}
}
