package my.suitabilityadvisor.app.llm;

import my.suitabilityadvisor.app.domain.UploadedDocument;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the OpenAI Responses API. Documents are sent inline as base64 data URLs: images as
 * {@code input_image}, everything else as {@code input_file}.
 */
public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(3);
	private static final String JSON_ONLY_INSTRUCTION = "Respond in JSON only. Do not wrap in Markdown code fences.";

	private final RestClient restClient;
	private final String model;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public LlmResponse runJsonPrompt(String prompt) {
		return runJsonPrompt(prompt, null, null);
	}

	@Override
	public LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema) {
		Map<String, Object> request = buildRequest(prompt, List.of(), schemaName, schema);
		return callResponsesApi(request);
	}

	@Override
	public LlmResponse runDocumentPrompt(String prompt, List<UploadedDocument> documents) {
		return runDocumentPrompt(prompt, documents, null, null);
	}

	@Override
	public LlmResponse runDocumentPrompt(String prompt,
										 List<UploadedDocument> documents,
										 String schemaName,
										 Map<String, Object> schema) {
		Map<String, Object> request = buildRequest(prompt, documents, schemaName, schema);
		return callResponsesApi(request);
	}

	private Map<String, Object> buildRequest(String prompt,
											 List<UploadedDocument> documents,
											 String schemaName,
											 Map<String, Object> schema) {
		List<Map<String, Object>> userContent = new ArrayList<>();
		if (documents != null) {
			for (UploadedDocument document : documents) {
				userContent.add(documentPart(document));
			}
		}
		userContent.add(Map.of("type", "input_text", "text", prompt));

		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("input", List.of(
				Map.of("role", "system", "content", JSON_ONLY_INSTRUCTION),
				Map.of("role", "user", "content", userContent)
		));
		if (schemaName != null && schema != null) {
			request.put("text", Map.of("format", Map.of(
					"type", "json_schema",
					"name", schemaName,
					"schema", schema,
					"strict", true
			)));
		} else {
			request.put("text", Map.of("format", Map.of("type", "json_object")));
		}
		return request;
	}

	private Map<String, Object> documentPart(UploadedDocument document) {
		String mimeType = document.mimeType() == null || document.mimeType().isBlank()
				? MediaType.APPLICATION_OCTET_STREAM_VALUE
				: document.mimeType();
		String dataUrl = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(document.content());
		if (mimeType.toLowerCase(Locale.ROOT).startsWith("image/")) {
			return Map.of("type", "input_image", "image_url", dataUrl);
		}
		String filename = document.name() == null ? "document" : document.name();
		return Map.of("type", "input_file", "filename", filename, "file_data", dataUrl);
	}

	private LlmResponse callResponsesApi(Map<String, Object> request) {
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/responses").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		} catch (Exception ex) {
			throw new LlmRequestException(safeMessage(ex), null, false, ex);
		}
		String text = extractOutputText(response);
		if (text == null || text.isBlank()) {
			throw new LlmRequestException("No output_text", null, false, null);
		}
		return new LlmResponse(text, model);
	}

	private String extractOutputText(Map<?, ?> response) {
		if (response == null) {
			return null;
		}
		Object outputText = response.get("output_text");
		if (outputText instanceof String text && !text.isBlank()) {
			return text;
		}
		Object output = response.get("output");
		if (!(output instanceof List<?> outputList) || outputList.isEmpty()) {
			return null;
		}
		StringBuilder combined = new StringBuilder();
		for (Object outputItem : outputList) {
			if (!(outputItem instanceof Map<?, ?> outputMap)) {
				continue;
			}
			Object content = outputMap.get("content");
			if (!(content instanceof List<?> contentList)) {
				continue;
			}
			for (Object contentItem : contentList) {
				if (!(contentItem instanceof Map<?, ?> contentMap)) {
					continue;
				}
				Object type = contentMap.get("type");
				if (type != null && !"output_text".equals(type.toString())) {
					continue;
				}
				Object text = contentMap.get("text");
				if (text == null) {
					continue;
				}
				if (!combined.isEmpty()) {
					combined.append("\n");
				}
				combined.append(text);
			}
		}
		return combined.toString();
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		if (ex == null) {
			return "Unknown error";
		}
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
