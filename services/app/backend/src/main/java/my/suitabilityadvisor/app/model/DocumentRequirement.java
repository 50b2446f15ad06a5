package my.suitabilityadvisor.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DocumentRequirement {
	private final String slot;
	private final String label;
	private final boolean required;
	private final String description;
}
