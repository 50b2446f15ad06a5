package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.RunState;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.util.List;

public record StartedRun(RunToken token, ManualFields manualFields, List<UploadedDocument> documents, RunState state) {
	public StartedRun {
		documents = documents == null ? List.of() : List.copyOf(documents);
	}
}
