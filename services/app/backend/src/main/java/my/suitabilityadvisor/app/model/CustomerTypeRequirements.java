package my.suitabilityadvisor.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import my.suitabilityadvisor.app.domain.CustomerKind;

import java.util.List;

@Getter
@AllArgsConstructor
public class CustomerTypeRequirements {
	private final CustomerKind customerType;
	private final List<DocumentRequirement> documents;
	private final List<InputRequirement> inputs;
}
