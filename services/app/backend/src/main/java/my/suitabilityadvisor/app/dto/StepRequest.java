package my.suitabilityadvisor.app.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record StepRequest(@NotNull @Min(1) @Max(3) Integer step) {
}
