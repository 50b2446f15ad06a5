package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.Product;

import java.util.List;

public record ProductDraft(Product product, List<String> warnings, String model) {
	public ProductDraft {
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}
}
