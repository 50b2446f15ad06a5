package my.suitabilityadvisor.app.session;

import my.suitabilityadvisor.app.domain.AnalysisStage;
import my.suitabilityadvisor.app.domain.CustomerProfile;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.RunStatus;
import my.suitabilityadvisor.app.domain.UploadedDocument;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record SessionSnapshot(
		Integer step,
		ManualFields manualFields,
		List<UploadedDocument> documents,
		CustomerProfile profile,
		List<EvaluationResult> evaluations,
		Long runId,
		RunStatus status,
		AnalysisStage stage,
		Integer progress,
		String error,
		Instant lastActivity
) {
	public SessionSnapshot withDefaults(Instant now) {
		return new SessionSnapshot(
				step == null || step < 1 ? 1 : step,
				manualFields == null ? ManualFields.defaults() : ManualFields.defaults().merge(manualFields),
				withoutNulls(documents),
				profile == null ? CustomerProfile.initial() : profile,
				withoutNulls(evaluations),
				runId == null ? 0L : runId,
				status == null ? RunStatus.IDLE : status,
				stage == null ? AnalysisStage.NONE : stage,
				progress == null ? 0 : Math.max(0, Math.min(100, progress)),
				error,
				lastActivity == null ? now : lastActivity
		);
	}

	private static <T> List<T> withoutNulls(List<T> items) {
		return items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
	}
}
