package my.suitabilityadvisor.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.suitabilityadvisor.app.dto.ManualFieldsUpdateRequest;
import my.suitabilityadvisor.app.dto.SessionStateDto;
import my.suitabilityadvisor.app.dto.StepRequest;
import my.suitabilityadvisor.app.service.IntakeService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/session")
@Tag(name = "Session")
public class SessionController {
	private final IntakeService intakeService;

	public SessionController(IntakeService intakeService) {
		this.intakeService = intakeService;
	}

	@GetMapping
	@Operation(summary = "Get the current session")
	public SessionStateDto getSession() {
		return intakeService.getSession();
	}

	@PutMapping("/manual-fields")
	@Operation(summary = "Update declared customer fields")
	public SessionStateDto updateManualFields(@Valid @RequestBody ManualFieldsUpdateRequest request) {
		return intakeService.updateManualFields(request.toManualFields());
	}

	@PutMapping("/step")
	@Operation(summary = "Set the wizard step")
	public SessionStateDto setStep(@Valid @RequestBody StepRequest request) {
		return intakeService.setStep(request.step());
	}

	@PostMapping(path = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Upload documents into a slot")
	public SessionStateDto uploadDocuments(@RequestParam("files") List<MultipartFile> files,
										   @RequestParam("slot") String slot) {
		return intakeService.addDocuments(files, slot);
	}

	@DeleteMapping("/documents")
	@Operation(summary = "Remove an uploaded document")
	public SessionStateDto removeDocument(@RequestParam("name") String name, @RequestParam("slot") String slot) {
		return intakeService.removeDocument(name, slot);
	}

	@DeleteMapping
	@Operation(summary = "Clear the session")
	public SessionStateDto clearSession() {
		return intakeService.clear();
	}
}
