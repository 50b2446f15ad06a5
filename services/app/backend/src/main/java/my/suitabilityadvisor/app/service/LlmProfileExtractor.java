package my.suitabilityadvisor.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.LlmResponse;
import my.suitabilityadvisor.app.service.util.LlmJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class LlmProfileExtractor implements ProfileExtractor {
	private static final Logger logger = LoggerFactory.getLogger(LlmProfileExtractor.class);
	private static final String INVALID_OUTPUT = "invalid_profile_output";
	private static final String RESPONSE_SCHEMA = """
			{
			  "type": "object",
			  "additionalProperties": false,
			  "required": ["customer_type","name","age","citizenship","country_of_residence","monthly_income","monthly_expenses",
			    "existing_loan_emi","total_credit_card_limits","total_credit_card_utilization","business_age_months",
			    "average_monthly_revenue","average_monthly_net_profit","bounced_cheques_last_12_months",
			    "late_payment_incidents_last_12_months","savings_balance_estimate","debt_to_income_ratio","dscr",
			    "risk_flags","notes"],
			  "properties": {
			    "customer_type": { "type": "string", "enum": ["INDIVIDUAL","SME"] },
			    "name": { "type": ["string","null"] },
			    "age": { "type": ["number","null"] },
			    "citizenship": { "type": ["string","null"] },
			    "country_of_residence": { "type": ["string","null"] },
			    "monthly_income": { "type": ["number","null"] },
			    "monthly_expenses": { "type": ["number","null"] },
			    "existing_loan_emi": { "type": ["number","null"] },
			    "total_credit_card_limits": { "type": ["number","null"] },
			    "total_credit_card_utilization": { "type": ["number","null"] },
			    "business_age_months": { "type": ["number","null"] },
			    "average_monthly_revenue": { "type": ["number","null"] },
			    "average_monthly_net_profit": { "type": ["number","null"] },
			    "bounced_cheques_last_12_months": { "type": ["number","null"] },
			    "late_payment_incidents_last_12_months": { "type": ["number","null"] },
			    "savings_balance_estimate": { "type": ["number","null"] },
			    "debt_to_income_ratio": { "type": ["number","null"] },
			    "dscr": { "type": ["number","null"] },
			    "risk_flags": { "type": "array", "items": { "type": "string" } },
			    "notes": { "type": ["string","null"] }
			  }
			}
			""";

	private final LlmClient llmClient;
	private final ObjectMapper objectMapper;
	private final Map<String, Object> responseSchema;
	private final JsonSchema outputSchema;

	public LlmProfileExtractor(LlmClient llmClient, ObjectMapper objectMapper) {
		this.llmClient = llmClient;
		this.objectMapper = objectMapper;
		this.responseSchema = LlmJson.readSchema(objectMapper, RESPONSE_SCHEMA, "profile extraction response");
		this.outputSchema = LlmJson.compileSchema(objectMapper, RESPONSE_SCHEMA, "profile extraction response");
	}

	@Override
	public CustomerProfile extract(List<UploadedDocument> documents, ManualFields manualFields) {
		ManualFields fields = manualFields == null ? ManualFields.defaults() : manualFields;
		String prompt = buildPrompt(documents, fields);
		logger.debug("Sending profile extraction prompt to LLM: {}", prompt);
		LlmResponse response = llmClient.runDocumentPrompt(prompt, documents, "customer_profile", responseSchema);
		JsonNode root = LlmJson.readObject(objectMapper, response.output(), INVALID_OUTPUT);
		LlmJson.requireSchemaMatch(outputSchema, root, INVALID_OUTPUT, "Profile extraction");
		CustomerProfile profile = toProfile(root);
		logger.info("Extracted {} profile from {} document(s) (model={}, riskFlags={})",
				profile.customerType(), documents.size(), response.model(), profile.riskFlags().size());
		return profile;
	}

	CustomerProfile toProfile(JsonNode root) {
		return CustomerProfile.builder()
				.customerType(LlmJson.enumOrNull(CustomerKind.class, root, "customer_type"))
				.name(LlmJson.textOrNull(root, "name"))
				.age(LlmJson.integerOrNull(root, "age"))
				.citizenship(LlmJson.textOrNull(root, "citizenship"))
				.countryOfResidence(LlmJson.textOrNull(root, "country_of_residence"))
				.monthlyIncome(LlmJson.doubleOrNull(root, "monthly_income"))
				.monthlyExpenses(LlmJson.doubleOrNull(root, "monthly_expenses"))
				.existingLoanEmi(LlmJson.doubleOrNull(root, "existing_loan_emi"))
				.totalCreditCardLimits(LlmJson.doubleOrNull(root, "total_credit_card_limits"))
				.totalCreditCardUtilization(LlmJson.doubleOrNull(root, "total_credit_card_utilization"))
				.businessAgeMonths(LlmJson.integerOrNull(root, "business_age_months"))
				.averageMonthlyRevenue(LlmJson.doubleOrNull(root, "average_monthly_revenue"))
				.averageMonthlyNetProfit(LlmJson.doubleOrNull(root, "average_monthly_net_profit"))
				.bouncedChequesLast12Months(LlmJson.integerOrNull(root, "bounced_cheques_last_12_months"))
				.latePaymentIncidentsLast12Months(LlmJson.integerOrNull(root, "late_payment_incidents_last_12_months"))
				.savingsBalanceEstimate(LlmJson.doubleOrNull(root, "savings_balance_estimate"))
				.debtToIncomeRatio(LlmJson.doubleOrNull(root, "debt_to_income_ratio"))
				.dscr(LlmJson.doubleOrNull(root, "dscr"))
				.riskFlags(LlmJson.stringList(root, "risk_flags"))
				.notes(LlmJson.textOrNull(root, "notes"))
				.build();
	}

	private String buildPrompt(List<UploadedDocument> documents, ManualFields fields) {
		StringBuilder files = new StringBuilder();
		for (UploadedDocument document : documents) {
			files.append("File Name: ").append(document.name())
					.append(", Document Type: ").append(document.docType() == null ? "UNKNOWN" : document.docType())
					.append('\n');
		}
		return """
				You are an expert financial analyst and a precise data extraction engine for financial documents.
				Analyze the attached documents (bank statements, payslips, invoices) together with the manual inputs below.

				Attached files:
				%s
				Analysis rules by document type:
				- BANK_STATEMENT: extract monthly income, recurring expenses and existing loan EMIs. Look for bounced cheques or gambling. Estimate DTI.
				- PAYSLIP: confirm net salary and employment stability.
				- ID_DOCUMENT: extract full name, age or date of birth, citizenship.
				- TRADE_LICENSE: extract the business start date (for business_age_months) and the legal business name.
				- PANDL_SUMMARY: extract average monthly revenue and net profit.
				- SALES_DASHBOARD: corroborate revenue stability and seasonality.

				Manual inputs:
				- Type: %s
				- Goal: %s
				- Risk Tolerance: %s
				- Name: %s
				- Citizenship: %s
				- Residence: %s

				Task:
				1. Extract all financial metrics found in the documents.
				2. Derive Debt-to-Income (monthly debt payments / gross monthly income) and DSCR (net operating income / total debt service) where possible.
				3. Identify risk flags (e.g. "High Overdraft Usage", "Declining Revenue", "Gambling Transactions").
				4. Use null for any value that is missing and cannot reasonably be estimated.
				5. For notes, write a brief professional summary of the financial situation (2-3 sentences).
				Return a single JSON object.
				""".formatted(
				files,
				fields.customerTypeOrDefault(),
				fields.goal(),
				fields.riskTolerance(),
				orUnknown(fields.name()),
				orUnknown(fields.citizenship()),
				orUnknown(fields.countryOfResidence()));
	}

	private static String orUnknown(String value) {
		return value == null || value.isBlank() ? "Unknown" : value;
	}
}
