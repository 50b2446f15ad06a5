package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.llm.LlmRequestException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps a run failure to the single message shown to the user. Classification only affects display; the
 * raw error is logged separately.
 */
@Component
public class AnalysisErrorClassifier {
	public static final String INVALID_API_KEY = "Invalid or missing API Key.";
	public static final String BAD_REQUEST = "Bad Request: The AI could not process these documents.";
	public static final String SERVER_ERROR = "Server Error: The AI service is currently experiencing issues.";
	public static final String GENERIC = "Analysis failed. Please try again.";

	public String classify(Throwable error) {
		Throwable cause = unwrap(error);
		if (cause instanceof DocumentValidationException) {
			return cause.getMessage();
		}
		if (cause instanceof CollaboratorTimeoutException) {
			return SERVER_ERROR;
		}
		Integer status = cause instanceof LlmRequestException request ? request.getStatusCode() : null;
		String message = cause == null || cause.getMessage() == null ? "" : cause.getMessage();
		String lower = message.toLowerCase(Locale.ROOT);
		// an upstream fault outranks a bad request, which outranks a credential marker
		if (isStatus(status, message, 500) || (status != null && status >= 500) || lower.contains("timed out")
				|| lower.contains("timeout")) {
			return SERVER_ERROR;
		}
		if (isStatus(status, message, 400)) {
			return BAD_REQUEST;
		}
		if (lower.contains("api key") || lower.contains("api_key") || isStatus(status, message, 401) || isStatus(status, message, 403)) {
			return INVALID_API_KEY;
		}
		return GENERIC;
	}

	private static boolean isStatus(Integer status, String message, int code) {
		if (status != null) {
			return status == code;
		}
		return message.matches("(?s).*\\b" + code + "\\b.*");
	}

	private static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
