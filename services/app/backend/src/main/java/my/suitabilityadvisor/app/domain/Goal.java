package my.suitabilityadvisor.app.domain;

public enum Goal {
	CREDIT_CARD,
	PERSONAL_LOAN,
	MORTGAGE,
	SME_WORKING_CAPITAL,
	BUSINESS_EXPANSION,
	OTHER
}
