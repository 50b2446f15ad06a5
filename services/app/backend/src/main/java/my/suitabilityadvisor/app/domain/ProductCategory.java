package my.suitabilityadvisor.app.domain;

public enum ProductCategory {
	CREDIT_CARD,
	PERSONAL_LOAN,
	SME_LOAN
}
