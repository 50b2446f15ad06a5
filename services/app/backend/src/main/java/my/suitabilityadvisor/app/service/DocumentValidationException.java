package my.suitabilityadvisor.app.service;

import java.util.List;

public class DocumentValidationException extends RuntimeException {
	static final String HEADER = "Document Validation Failed:";

	private final List<String> issues;

	public DocumentValidationException(List<String> issues) {
		super(HEADER + "\n• " + String.join("\n• ", issues));
		this.issues = List.copyOf(issues);
	}

	public List<String> getIssues() {
		return issues;
	}
}
