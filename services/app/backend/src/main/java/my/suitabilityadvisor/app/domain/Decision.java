package my.suitabilityadvisor.app.domain;

public enum Decision {
	APPROVE,
	REVIEW,
	DECLINE
}
