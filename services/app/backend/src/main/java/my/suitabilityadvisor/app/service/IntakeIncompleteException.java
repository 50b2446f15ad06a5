package my.suitabilityadvisor.app.service;

import java.util.List;

public class IntakeIncompleteException extends RuntimeException {
	private final List<String> missing;

	public IntakeIncompleteException(List<String> missing) {
		super("Missing required intake items: " + String.join(", ", missing));
		this.missing = List.copyOf(missing);
	}

	public List<String> getMissing() {
		return missing;
	}
}
