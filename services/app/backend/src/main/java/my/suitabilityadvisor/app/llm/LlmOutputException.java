package my.suitabilityadvisor.app.llm;

public class LlmOutputException extends RuntimeException {
	private final String errorCode;

	public LlmOutputException(String message, String errorCode) {
		super(message);
		this.errorCode = errorCode;
	}

	public LlmOutputException(String message, String errorCode, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public String getErrorCode() {
		return errorCode;
	}
}
