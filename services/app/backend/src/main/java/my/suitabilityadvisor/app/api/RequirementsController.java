package my.suitabilityadvisor.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.model.CustomerTypeRequirements;
import my.suitabilityadvisor.app.service.IntakeRequirementsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/requirements")
@Tag(name = "Session")
public class RequirementsController {
	private final IntakeRequirementsService requirementsService;

	public RequirementsController(IntakeRequirementsService requirementsService) {
		this.requirementsService = requirementsService;
	}

	@GetMapping("/{customerType}")
	@Operation(summary = "Get intake requirements for a customer type")
	public CustomerTypeRequirements getRequirements(@PathVariable("customerType") CustomerKind customerType) {
		return requirementsService.requirementsFor(customerType);
	}
}
