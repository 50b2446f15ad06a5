package my.suitabilityadvisor.app.domain;

import java.util.List;

public record DocumentValidation(
		String slotKey,
		String expectedDocType,
		String detectedName,
		String detectedDocType,
		boolean nameMatchesDeclared,
		boolean typeMatchesSlot,
		List<String> issues
) {
	public DocumentValidation {
		issues = issues == null ? List.of() : List.copyOf(issues);
	}

	public boolean passed() {
		return nameMatchesDeclared && typeMatchesSlot;
	}
}
