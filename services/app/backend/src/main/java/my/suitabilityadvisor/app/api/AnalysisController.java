package my.suitabilityadvisor.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.suitabilityadvisor.app.dto.AnalysisRunDto;
import my.suitabilityadvisor.app.service.AnalysisPipelineService;
import my.suitabilityadvisor.app.service.IntakeService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Analysis")
public class AnalysisController {
	private final AnalysisPipelineService pipelineService;
	private final IntakeService intakeService;

	public AnalysisController(AnalysisPipelineService pipelineService, IntakeService intakeService) {
		this.pipelineService = pipelineService;
		this.intakeService = intakeService;
	}

	@PostMapping("/run")
	@ResponseStatus(HttpStatus.ACCEPTED)
	@Operation(summary = "Start an analysis run", description = "Supersedes any run still in flight.")
	public AnalysisRunDto startRun() {
		intakeService.requireComplete();
		return AnalysisRunDto.from(pipelineService.start());
	}

	@PostMapping("/cancel")
	@Operation(summary = "Cancel the running analysis")
	public AnalysisRunDto cancelRun() {
		pipelineService.cancel();
		return AnalysisRunDto.from(pipelineService.current());
	}

	@GetMapping("/status")
	@Operation(summary = "Get the current run state")
	public AnalysisRunDto getStatus() {
		return AnalysisRunDto.from(pipelineService.current());
	}
}
