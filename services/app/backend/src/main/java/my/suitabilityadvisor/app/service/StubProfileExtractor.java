package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

public class StubProfileExtractor implements ProfileExtractor {
	static final String NOTES = "No document extraction available; profile contains declared fields only.";

	@Override
	public CustomerProfile extract(List<UploadedDocument> documents, ManualFields manualFields) {
		ManualFields fields = manualFields == null ? ManualFields.defaults() : manualFields;
		return CustomerProfile.initial(fields.customerTypeOrDefault())
				.toBuilder()
				.notes(NOTES)
				.build();
	}
}
