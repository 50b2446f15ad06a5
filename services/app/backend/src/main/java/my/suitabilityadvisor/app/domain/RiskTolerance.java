package my.suitabilityadvisor.app.domain;

public enum RiskTolerance {
	LOW,
	MEDIUM,
	HIGH
}
