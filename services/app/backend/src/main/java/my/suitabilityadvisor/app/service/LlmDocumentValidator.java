package my.suitabilityadvisor.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.DocumentValidation;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.llm.LlmClient;
import my.suitabilityadvisor.app.llm.LlmResponse;
import my.suitabilityadvisor.app.service.util.LlmJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class LlmDocumentValidator implements DocumentValidator {
	private static final Logger logger = LoggerFactory.getLogger(LlmDocumentValidator.class);
	private static final String INVALID_OUTPUT = "invalid_validation_output";
	private static final String RESPONSE_SCHEMA = """
			{
			  "type": "object",
			  "additionalProperties": false,
			  "required": ["document_validations"],
			  "properties": {
			    "document_validations": {
			      "type": "array",
			      "items": {
			        "type": "object",
			        "additionalProperties": false,
			        "required": ["slot_key","expected_doc_type","detected_name","detected_doc_type","name_matches_declared","type_matches_slot","issues"],
			        "properties": {
			          "slot_key": { "type": "string" },
			          "expected_doc_type": { "type": "string" },
			          "detected_name": { "type": ["string","null"] },
			          "detected_doc_type": { "type": ["string","null"] },
			          "name_matches_declared": { "type": "boolean" },
			          "type_matches_slot": { "type": "boolean" },
			          "issues": { "type": "array", "items": { "type": "string" } }
			        }
			      }
			    }
			  }
			}
			""";

	private final LlmClient llmClient;
	private final ObjectMapper objectMapper;
	private final Map<String, Object> responseSchema;
	private final JsonSchema outputSchema;

	public LlmDocumentValidator(LlmClient llmClient, ObjectMapper objectMapper) {
		this.llmClient = llmClient;
		this.objectMapper = objectMapper;
		this.responseSchema = LlmJson.readSchema(objectMapper, RESPONSE_SCHEMA, "document validation response");
		this.outputSchema = LlmJson.compileSchema(objectMapper, RESPONSE_SCHEMA, "document validation response");
	}

	@Override
	public List<DocumentValidation> validate(List<UploadedDocument> documents, CustomerKind declaredKind, String declaredName) {
		String prompt = buildPrompt(documents, declaredKind, declaredName);
		logger.debug("Sending document validation prompt to LLM: {}", prompt);
		LlmResponse response = llmClient.runDocumentPrompt(prompt, documents, "document_validation", responseSchema);
		JsonNode root = LlmJson.readObject(objectMapper, response.output(), INVALID_OUTPUT);
		LlmJson.requireSchemaMatch(outputSchema, root, INVALID_OUTPUT, "Document validation");
		List<DocumentValidation> validations = new ArrayList<>();
		for (JsonNode item : root.get("document_validations")) {
			validations.add(new DocumentValidation(
					LlmJson.textOrNull(item, "slot_key"),
					LlmJson.textOrNull(item, "expected_doc_type"),
					LlmJson.textOrNull(item, "detected_name"),
					LlmJson.textOrNull(item, "detected_doc_type"),
					item.get("name_matches_declared").booleanValue(),
					item.get("type_matches_slot").booleanValue(),
					LlmJson.stringList(item, "issues")
			));
		}
		logger.info("Document validation returned {} result(s) for {} document(s) (model={})",
				validations.size(), documents.size(), response.model());
		return validations;
	}

	private String buildPrompt(List<UploadedDocument> documents, CustomerKind declaredKind, String declaredName) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("""
				You are a document intake checker for a bank. The attached files were uploaded into named slots.
				For every file, decide which kind of document it really is and whose name appears on it.

				Declared customer type: %s
				Declared name: %s

				Attached files (in the same order as the attachments):
				""".formatted(declaredKind == null ? CustomerKind.INDIVIDUAL : declaredKind,
				declaredName == null || declaredName.isBlank() ? "Unknown" : declaredName));
		int index = 1;
		for (UploadedDocument document : documents) {
			prompt.append("- #").append(index++)
					.append(" File Name: ").append(document.name())
					.append(", Slot: ").append(document.docType() == null ? "UNKNOWN" : document.docType())
					.append('\n');
		}
		prompt.append("""

				Rules:
				- slot_key and expected_doc_type are the slot the file was uploaded into.
				- detected_doc_type is what the document actually is (e.g. BANK_STATEMENT, PAYSLIP, ID_DOCUMENT, TRADE_LICENSE, PANDL_SUMMARY, SALES_DASHBOARD, UTILITY_BILL, OTHER).
				- type_matches_slot is false when the document clearly does not belong in its slot.
				- detected_name is the person or business name printed on the document, or null.
				- name_matches_declared is false only when a different name is clearly visible. Minor spelling or ordering differences still match.
				- issues lists short, human-readable problems for that file; use an empty list when there are none.

				Return a single JSON object with a document_validations array containing one entry per file.
				""");
		return prompt.toString();
	}
}
