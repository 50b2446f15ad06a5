package my.suitabilityadvisor.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import my.suitabilityadvisor.app.catalog.ProductCatalogLoader;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.LlmOutputException;
import my.suitabilityadvisor.app.llm.LlmResponse;
import my.suitabilityadvisor.app.service.util.LlmJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

public class LlmProductDraftGenerator implements ProductDraftGenerator {
	private static final Logger logger = LoggerFactory.getLogger(LlmProductDraftGenerator.class);
	private static final String INVALID_OUTPUT = "invalid_product_output";
	private static final String GENERATED_ID_PREFIX = "prod_gen_";
	private static final String PRODUCT_SCHEMA = """
			{
			  "type": "object",
			  "required": ["name","category","target_customer_type"],
			  "properties": {
			    "id": { "type": ["string","null"] },
			    "name": { "type": "string" },
			    "category": { "type": "string", "enum": ["CREDIT_CARD","PERSONAL_LOAN","SME_LOAN"] },
			    "description": { "type": ["string","null"] },
			    "target_customer_type": { "type": "string", "enum": ["INDIVIDUAL","SME","BOTH"] },
			    "constraints": {
			      "type": ["object","null"],
			      "additionalProperties": false,
			      "properties": {
			        "min_age": { "type": ["integer","null"] },
			        "max_age": { "type": ["integer","null"] },
			        "min_monthly_income": { "type": ["number","null"] },
			        "min_average_monthly_revenue": { "type": ["number","null"] },
			        "min_business_age_months": { "type": ["integer","null"] },
			        "max_debt_to_income": { "type": ["number","null"] },
			        "min_dscr": { "type": ["number","null"] },
			        "max_bounced_cheques_last12_months": { "type": ["integer","null"] },
			        "max_late_payment_incidents_last12_months": { "type": ["integer","null"] }
			      }
			    },
			    "scoring": {
			      "type": ["object","null"],
			      "additionalProperties": false,
			      "properties": {
			        "weights": {
			          "type": ["object","null"],
			          "additionalProperties": false,
			          "properties": {
			            "income_stability": { "type": ["number","null"] },
			            "revenue_stability": { "type": ["number","null"] },
			            "debt_to_income": { "type": ["number","null"] },
			            "dscr": { "type": ["number","null"] },
			            "credit_utilization": { "type": ["number","null"] },
			            "bounced_cheques": { "type": ["number","null"] },
			            "late_payments": { "type": ["number","null"] }
			          }
			        },
			        "thresholds": {
			          "type": ["object","null"],
			          "additionalProperties": false,
			          "required": ["approve","review"],
			          "properties": {
			            "approve": { "type": "number" },
			            "review": { "type": "number" }
			          }
			        }
			      }
			    },
			    "explanation_templates": {
			      "type": ["object","null"],
			      "additionalProperties": false,
			      "properties": {
			        "approved": { "type": ["string","null"] },
			        "review": { "type": ["string","null"] },
			        "declined": { "type": ["string","null"] }
			      }
			    }
			  }
			}
			""";

	private final LlmClient llmClient;
	private final ProductCatalogLoader catalogLoader;
	private final ObjectMapper objectMapper;
	private final JsonSchema productSchema;

	public LlmProductDraftGenerator(LlmClient llmClient, ProductCatalogLoader catalogLoader, ObjectMapper objectMapper) {
		this.llmClient = llmClient;
		this.catalogLoader = catalogLoader;
		this.objectMapper = objectMapper;
		this.productSchema = LlmJson.compileSchema(objectMapper, PRODUCT_SCHEMA, "product draft");
	}

	@Override
	public ProductDraft generate(String description) {
		if (description == null || description.isBlank()) {
			throw new IllegalArgumentException("description is required");
		}
		LlmResponse response = llmClient.runJsonPrompt(buildPrompt(description.trim()));
		Product parsed = parse(response.output());
		Product product = parsed.id() == null || parsed.id().isBlank() ? withGeneratedId(parsed) : parsed;
		List<String> warnings = catalogLoader.validate(product);
		logger.info("Generated product draft {} ({} warning(s), model={})", product.id(), warnings.size(), response.model());
		return new ProductDraft(product, warnings, response.model());
	}

	private Product parse(String output) {
		JsonNode root = LlmJson.readObject(objectMapper, output, INVALID_OUTPUT);
		LlmJson.requireSchemaMatch(productSchema, root, INVALID_OUTPUT, "Product draft");
		try {
			return catalogLoader.parseProduct(root.toString());
		} catch (IOException ex) {
			throw new LlmOutputException("LLM output is not a valid product: " + ex.getMessage(), INVALID_OUTPUT, ex);
		}
	}

	private Product withGeneratedId(Product product) {
		String id = GENERATED_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
		return new Product(id, product.name(), product.category(), product.description(), product.targetCustomerType(),
				product.constraints(), product.scoring(), product.explanationTemplates());
	}

	private String buildPrompt(String description) {
		return """
				Convert the following natural language product description into a product configuration JSON object.

				Description: "%s"

				Use exactly these snake_case keys:
				- id (string), name (string), description (string)
				- category: one of CREDIT_CARD, PERSONAL_LOAN, SME_LOAN
				- target_customer_type: one of INDIVIDUAL, SME, BOTH
				- constraints: object with optional min_age, max_age, min_monthly_income, min_average_monthly_revenue,
				  min_business_age_months, max_debt_to_income, min_dscr, max_bounced_cheques_last12_months,
				  max_late_payment_incidents_last12_months (omit limits the description does not imply)
				- scoring: object with weights (income_stability, revenue_stability, debt_to_income, dscr, credit_utilization,
				  bounced_cheques, late_payments; non-negative numbers) and thresholds (approve, review; 0..1, approve >= review)
				- explanation_templates: object with approved, review, declined strings; {{productName}} may be used

				Infer category and strictness from the text. Return strict JSON only.
				""".formatted(description);
	}
}
