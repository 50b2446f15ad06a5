package my.suitabilityadvisor.app.dto;

public record DocumentSummaryDto(String name, String mimeType, String docType, int sizeBytes) {
}
