package my.suitabilityadvisor.app.llm;

import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;
import java.util.Map;

public interface LlmClient {
	LlmResponse runJsonPrompt(String prompt);

	default LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema) {
		return runJsonPrompt(prompt);
	}

	LlmResponse runDocumentPrompt(String prompt, List<UploadedDocument> documents);

	default LlmResponse runDocumentPrompt(String prompt,
										  List<UploadedDocument> documents,
										  String schemaName,
										  Map<String, Object> schema) {
		return runDocumentPrompt(prompt, documents);
	}
}
