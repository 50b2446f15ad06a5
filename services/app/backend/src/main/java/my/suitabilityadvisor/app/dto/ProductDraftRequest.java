package my.suitabilityadvisor.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProductDraftRequest(@NotBlank @Size(max = 4000) String description) {
}
