package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

public interface ProfileExtractor {
	CustomerProfile extract(List<UploadedDocument> documents, ManualFields manualFields);
}
