package my.suitabilityadvisor.app.llm;

import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmResponse runJsonPrompt(String prompt) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}

	@Override
	public LlmResponse runDocumentPrompt(String prompt, List<UploadedDocument> documents) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}
}
