package my.suitabilityadvisor.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InputRequirement {
	private final String field;
	private final boolean required;
}
