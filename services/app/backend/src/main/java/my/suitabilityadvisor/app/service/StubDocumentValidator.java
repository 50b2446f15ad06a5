package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.DocumentValidation;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

public class StubDocumentValidator implements DocumentValidator {
	@Override
	public List<DocumentValidation> validate(List<UploadedDocument> documents, CustomerKind declaredKind, String declaredName) {
		return documents.stream()
				.map(document -> new DocumentValidation(
						document.docType(),
						document.docType(),
						declaredName,
						document.docType(),
						true,
						true,
						List.of()))
				.toList();
	}
}
