package my.suitabilityadvisor.app.llm;

public record LlmResponse(String output, String model) {
}
