package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.dto.AnalysisRunDto;
import my.suitabilityadvisor.app.dto.DocumentSummaryDto;
import my.suitabilityadvisor.app.dto.SessionStateDto;
import my.suitabilityadvisor.app.model.DocumentRequirement;
import my.suitabilityadvisor.app.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Service
public class IntakeService {
	private static final Logger logger = LoggerFactory.getLogger(IntakeService.class);
	private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

	private final SuitabilitySession session;
	private final IntakeRequirementsService requirementsService;

	public IntakeService(SuitabilitySession session, IntakeRequirementsService requirementsService) {
		this.session = session;
		this.requirementsService = requirementsService;
	}

	public SessionStateDto getSession() {
		return toDto(session.snapshot());
	}

	public SessionStateDto updateManualFields(ManualFields update) {
		try {
			session.updateManualFields(update);
		} catch (IllegalStateException ex) {
			throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage());
		}
		return getSession();
	}

	public SessionStateDto addDocuments(List<MultipartFile> files, String slot) {
		if (files == null || files.isEmpty()) {
			throw new IllegalArgumentException("At least one file is required.");
		}
		String docType = requireKnownSlot(slot);
		List<UploadedDocument> documents = new ArrayList<>();
		for (MultipartFile file : files) {
			if (file == null || file.isEmpty()) {
				throw new IllegalArgumentException("Uploaded file is empty.");
			}
			String name = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
					? "upload"
					: file.getOriginalFilename();
			String mimeType = file.getContentType() == null ? DEFAULT_MIME_TYPE : file.getContentType();
			try {
				documents.add(new UploadedDocument(name, mimeType, file.getBytes(), docType));
			} catch (IOException ex) {
				throw new IllegalArgumentException("Unable to read uploaded file " + name + ".", ex);
			}
		}
		session.addDocuments(documents);
		logger.info("Added {} document(s) to slot {}", documents.size(), docType);
		return getSession();
	}

	public SessionStateDto removeDocument(String name, String slot) {
		if (!session.removeDocument(name, slot)) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Document not found");
		}
		return getSession();
	}

	public SessionStateDto setStep(int step) {
		session.setStep(step);
		return getSession();
	}

	public SessionStateDto clear() {
		session.clear();
		logger.info("Session cleared");
		return getSession();
	}

	/**
	 * @throws IntakeIncompleteException when a required input or document is missing
	 */
	public void requireComplete() {
		List<String> missing = requirementsService.missingRequirements(session.manualFields(), session.documents());
		if (!missing.isEmpty()) {
			throw new IntakeIncompleteException(missing);
		}
	}

	private String requireKnownSlot(String slot) {
		if (slot == null || slot.isBlank()) {
			throw new IllegalArgumentException("slot is required");
		}
		String trimmed = slot.trim();
		boolean known = requirementsService.requirementsFor(session.manualFields().customerTypeOrDefault())
				.getDocuments()
				.stream()
				.map(DocumentRequirement::getSlot)
				.anyMatch(trimmed::equals);
		if (!known) {
			throw new IllegalArgumentException("Unknown document slot for the declared customer type: " + trimmed);
		}
		return trimmed;
	}

	private SessionStateDto toDto(SessionSnapshot snapshot) {
		List<DocumentSummaryDto> documents = snapshot.documents().stream()
				.map(document -> new DocumentSummaryDto(document.name(), document.mimeType(), document.docType(), document.size()))
				.toList();
		return new SessionStateDto(
				snapshot.step(),
				snapshot.manualFields(),
				documents,
				snapshot.profile(),
				snapshot.evaluations(),
				new AnalysisRunDto(snapshot.runId(), snapshot.status(), snapshot.stage(), snapshot.progress(),
						snapshot.error(), snapshot.lastActivity()),
				requirementsService.missingRequirements(snapshot.manualFields(), snapshot.documents())
		);
	}
}
