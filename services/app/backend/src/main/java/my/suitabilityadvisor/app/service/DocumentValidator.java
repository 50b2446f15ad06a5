package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.DocumentValidation;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

/**
 * Checks each uploaded document against its slot and the declared customer name. Faults propagate to
 * the caller; there is no retry.
 */
public interface DocumentValidator {
	List<DocumentValidation> validate(List<UploadedDocument> documents, CustomerKind declaredKind, String declaredName);
}
