package my.suitabilityadvisor.app.domain;

public record DecisionThresholds(double approve, double review) {
}
