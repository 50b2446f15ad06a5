package my.suitabilityadvisor.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.UploadedDocument;
import my.suitabilityadvisor.app.model.CustomerTypeRequirements;
import my.suitabilityadvisor.app.model.DocumentRequirement;
import my.suitabilityadvisor.app.model.InputRequirement;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class IntakeRequirementsService {
	static final String DEFAULT_LOCATION = "classpath:catalog/intake-requirements.json";
	private static final Set<String> KNOWN_INPUTS = Set.of(
			"name", "citizenship", "country_of_residence", "goal", "risk_tolerance", "customer_type");

	private final Map<CustomerKind, CustomerTypeRequirements> requirements;

	public IntakeRequirementsService(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
		this.requirements = load(resourceLoader.getResource(DEFAULT_LOCATION), objectMapper);
	}

	public CustomerTypeRequirements requirementsFor(CustomerKind kind) {
		CustomerTypeRequirements found = requirements.get(kind == null ? CustomerKind.INDIVIDUAL : kind);
		if (found == null) {
			return new CustomerTypeRequirements(kind, List.of(), List.of());
		}
		return found;
	}

	/**
	 * Returns the required inputs that are blank and the required slots without a document, inputs first.
	 */
	public List<String> missingRequirements(ManualFields fields, List<UploadedDocument> documents) {
		ManualFields current = fields == null ? ManualFields.defaults() : fields;
		CustomerTypeRequirements config = requirementsFor(current.customerTypeOrDefault());
		List<String> missing = new ArrayList<>();
		for (InputRequirement input : config.getInputs()) {
			if (input.isRequired() && isBlank(inputValue(current, input.getField()))) {
				missing.add(input.getField());
			}
		}
		for (DocumentRequirement document : config.getDocuments()) {
			if (!document.isRequired()) {
				continue;
			}
			boolean uploaded = documents != null && documents.stream()
					.anyMatch(uploadedDocument -> document.getSlot().equals(uploadedDocument.docType()));
			if (!uploaded) {
				missing.add(document.getSlot());
			}
		}
		return missing;
	}

	private static Object inputValue(ManualFields fields, String field) {
		return switch (field) {
			case "name" -> fields.name();
			case "citizenship" -> fields.citizenship();
			case "country_of_residence" -> fields.countryOfResidence();
			case "goal" -> fields.goal();
			case "risk_tolerance" -> fields.riskTolerance();
			case "customer_type" -> fields.customerType();
			default -> throw new IllegalStateException("Unknown intake input: " + field);
		};
	}

	private static boolean isBlank(Object value) {
		return value == null || value.toString().isBlank();
	}

	private static Map<CustomerKind, CustomerTypeRequirements> load(Resource resource, ObjectMapper objectMapper) {
		if (!resource.exists()) {
			throw new IllegalStateException("Intake requirements resource not found: " + DEFAULT_LOCATION);
		}
		JsonNode root;
		try (InputStream inputStream = resource.getInputStream()) {
			root = objectMapper.readTree(inputStream);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read intake requirements", ex);
		}
		Map<CustomerKind, CustomerTypeRequirements> result = new EnumMap<>(CustomerKind.class);
		for (CustomerKind kind : CustomerKind.values()) {
			JsonNode node = root.get(kind.name());
			if (node == null || node.isNull()) {
				continue;
			}
			List<DocumentRequirement> documents = new ArrayList<>();
			JsonNode documentsNode = node.path("documents");
			Iterator<Map.Entry<String, JsonNode>> slots = documentsNode.fields();
			while (slots.hasNext()) {
				Map.Entry<String, JsonNode> slot = slots.next();
				JsonNode value = slot.getValue();
				documents.add(new DocumentRequirement(
						slot.getKey(),
						value.path("label").asText(slot.getKey()),
						value.path("required").asBoolean(false),
						value.path("description").asText(null)));
			}
			List<InputRequirement> inputs = new ArrayList<>();
			Iterator<Map.Entry<String, JsonNode>> fields = node.path("inputs").fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				if (!KNOWN_INPUTS.contains(field.getKey())) {
					throw new IllegalStateException("Unknown intake input for " + kind + ": " + field.getKey());
				}
				inputs.add(new InputRequirement(field.getKey(), field.getValue().path("required").asBoolean(false)));
			}
			result.put(kind, new CustomerTypeRequirements(kind, List.copyOf(documents), List.copyOf(inputs)));
		}
		return result;
	}
}
