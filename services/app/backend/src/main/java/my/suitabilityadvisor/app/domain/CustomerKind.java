package my.suitabilityadvisor.app.domain;

public enum CustomerKind {
	INDIVIDUAL,
	SME
}
