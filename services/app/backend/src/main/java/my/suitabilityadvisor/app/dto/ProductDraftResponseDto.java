package my.suitabilityadvisor.app.dto;

import my.suitabilityadvisor.app.domain.Product;

import java.util.List;

public record ProductDraftResponseDto(Product product, List<String> warnings, String model) {
}
