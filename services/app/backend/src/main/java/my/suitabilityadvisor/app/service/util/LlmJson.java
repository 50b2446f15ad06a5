package my.suitabilityadvisor.app.service.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.suitabilityadvisor.app.llm.LlmOutputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsing and schema checks for JSON produced by an LLM. The field readers never throw for a missing
 * or mistyped value; numbers that are not finite read as missing.
 */
public final class LlmJson {
	private LlmJson() {
	}

	public static JsonNode readObject(ObjectMapper objectMapper, String output, String errorCode) {
		if (output == null || output.isBlank()) {
			throw new LlmOutputException("Empty LLM output", errorCode);
		}
		String json = stripCodeFences(output.trim());
		JsonNode node;
		try {
			node = objectMapper.readTree(json);
		} catch (Exception ex) {
			throw new LlmOutputException("LLM output is not valid JSON: " + ex.getMessage(), errorCode, ex);
		}
		if (node == null || !node.isObject()) {
			throw new LlmOutputException("LLM output is not a JSON object", errorCode);
		}
		return node;
	}

	public static Map<String, Object> readSchema(ObjectMapper objectMapper, String schema, String label) {
		try {
			return objectMapper.readValue(schema, new TypeReference<Map<String, Object>>() {});
		} catch (Exception ex) {
			throw new IllegalStateException("Failed to load " + label + " schema", ex);
		}
	}

	public static JsonSchema compileSchema(ObjectMapper objectMapper, String schema, String label) {
		try {
			JsonNode schemaNode = objectMapper.readTree(schema);
			return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
		} catch (Exception ex) {
			throw new IllegalStateException("Failed to compile " + label + " schema", ex);
		}
	}

	public static void requireSchemaMatch(JsonSchema schema, JsonNode payload, String errorCode, String label) {
		Set<ValidationMessage> errors = schema.validate(payload);
		if (!errors.isEmpty()) {
			String details = errors.stream()
					.map(ValidationMessage::getMessage)
					.sorted()
					.limit(5)
					.collect(Collectors.joining("; "));
			throw new LlmOutputException(label + " JSON did not match schema: " + details, errorCode);
		}
	}

	static String stripCodeFences(String text) {
		if (!text.startsWith("```")) {
			return text;
		}
		int firstNewline = text.indexOf('\n');
		int lastFence = text.lastIndexOf("```");
		if (firstNewline < 0 || lastFence <= firstNewline) {
			return text;
		}
		return text.substring(firstNewline + 1, lastFence).trim();
	}

	static JsonNode field(JsonNode node, String... names) {
		if (node == null || node.isNull()) {
			return null;
		}
		for (String name : names) {
			JsonNode value = node.get(name);
			if (value != null && !value.isNull()) {
				return value;
			}
		}
		return null;
	}

	public static String textOrNull(JsonNode node, String... names) {
		JsonNode value = field(node, names);
		if (value == null || value.isContainerNode()) {
			return null;
		}
		String text = value.asText();
		return text == null || text.isBlank() ? null : text.trim();
	}

	public static Double doubleOrNull(JsonNode node, String... names) {
		JsonNode value = field(node, names);
		if (value == null) {
			return null;
		}
		if (value.isNumber()) {
			return finiteOrNull(value.doubleValue());
		}
		if (value.isTextual()) {
			String text = value.asText().replace(",", "").trim();
			if (text.isEmpty()) {
				return null;
			}
			try {
				return finiteOrNull(Double.parseDouble(text));
			} catch (NumberFormatException ex) {
				return null;
			}
		}
		return null;
	}

	public static Integer integerOrNull(JsonNode node, String... names) {
		Double value = doubleOrNull(node, names);
		if (value == null) {
			return null;
		}
		long rounded = Math.round(value);
		if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
			return null;
		}
		return (int) rounded;
	}

	private static Double finiteOrNull(double value) {
		return Double.isFinite(value) ? value : null;
	}

	public static List<String> stringList(JsonNode node, String... names) {
		JsonNode value = field(node, names);
		List<String> items = new ArrayList<>();
		if (value == null || !value.isArray()) {
			return items;
		}
		for (JsonNode item : value) {
			if (item != null && !item.isNull() && !item.isContainerNode()) {
				String text = item.asText();
				if (text != null && !text.isBlank()) {
					items.add(text.trim());
				}
			}
		}
		return items;
	}

	public static <E extends Enum<E>> E enumOrNull(Class<E> type, JsonNode node, String... names) {
		String text = textOrNull(node, names);
		if (text == null) {
			return null;
		}
		String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
		try {
			return Enum.valueOf(type, normalized);
		} catch (IllegalArgumentException ex) {
			return null;
		}
	}
}
