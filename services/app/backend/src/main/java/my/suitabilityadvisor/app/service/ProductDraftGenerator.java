package my.suitabilityadvisor.app.service;

public interface ProductDraftGenerator {
	ProductDraft generate(String description);
}
