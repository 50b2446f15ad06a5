package my.suitabilityadvisor.app.domain;

public enum TargetCustomerType {
	INDIVIDUAL,
	SME,
	BOTH;

	public boolean includes(CustomerKind kind) {
		if (kind == null) {
			return false;
		}
		return this == BOTH || name().equals(kind.name());
	}
}
