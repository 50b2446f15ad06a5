package my.suitabilityadvisor.app.dto;

import jakarta.validation.constraints.Size;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.Goal;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.RiskTolerance;

public record ManualFieldsUpdateRequest(
		CustomerKind customerType,
		@Size(max = 200) String name,
		@Size(max = 100) String citizenship,
		@Size(max = 100) String countryOfResidence,
		Goal goal,
		RiskTolerance riskTolerance
) {
	public ManualFields toManualFields() {
		return new ManualFields(customerType, name, citizenship, countryOfResidence, goal, riskTolerance);
	}
}
