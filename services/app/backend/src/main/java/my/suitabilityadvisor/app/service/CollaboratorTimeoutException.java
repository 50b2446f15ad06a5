package my.suitabilityadvisor.app.service;

import java.time.Duration;

public class CollaboratorTimeoutException extends RuntimeException {
	public CollaboratorTimeoutException(String operation, Duration timeout) {
		super(operation + " timed out after " + timeout.toSeconds() + "s");
	}
}
