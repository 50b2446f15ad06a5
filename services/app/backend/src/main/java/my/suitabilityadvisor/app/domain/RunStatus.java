package my.suitabilityadvisor.app.domain;

public enum RunStatus {
	IDLE,
	RUNNING,
	SUCCESS,
	FAILED
}
