package my.suitabilityadvisor.app.service.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import my.suitabilityadvisor.app.domain.Goal;
import my.suitabilityadvisor.app.llm.LlmOutputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmJsonTest {
	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void readsFencedJson() {
		JsonNode node = LlmJson.readObject(objectMapper, "```json\n{\"a\": 1}\n```", "code");

		assertThat(node.get("a").asInt()).isEqualTo(1);
	}

	@Test
	void rejectsEmptyAndNonObjectOutput() {
		assertThatThrownBy(() -> LlmJson.readObject(objectMapper, "  ", "empty_code"))
				.isInstanceOfSatisfying(LlmOutputException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo("empty_code"));
		assertThatThrownBy(() -> LlmJson.readObject(objectMapper, "[1,2]", "code"))
				.isInstanceOf(LlmOutputException.class)
				.hasMessageContaining("not a JSON object");
		assertThatThrownBy(() -> LlmJson.readObject(objectMapper, "{not json", "code"))
				.isInstanceOf(LlmOutputException.class)
				.hasMessageContaining("not valid JSON");
	}

	@Test
	void leavesUnfencedTextAlone() {
		assertThat(LlmJson.stripCodeFences("{\"a\":1}")).isEqualTo("{\"a\":1}");
		assertThat(LlmJson.stripCodeFences("```{\"a\":1}```")).isEqualTo("```{\"a\":1}```");
	}

	@Test
	void numericReadersAreLenient() throws Exception {
		JsonNode node = objectMapper.readTree("""
				{"income": "12,500.50", "age": 41.6, "bad": "n/a", "blank": "", "camelCase": 3}
				""");

		assertThat(LlmJson.doubleOrNull(node, "income")).isEqualTo(12500.5);
		assertThat(LlmJson.integerOrNull(node, "age")).isEqualTo(42);
		assertThat(LlmJson.doubleOrNull(node, "bad")).isNull();
		assertThat(LlmJson.doubleOrNull(node, "blank")).isNull();
		assertThat(LlmJson.integerOrNull(node, "snake_case", "camelCase")).isEqualTo(3);
		assertThat(LlmJson.doubleOrNull(node, "missing")).isNull();
	}

	@Test
	void nonFiniteNumbersAreUnknown() throws Exception {
		JsonNode node = objectMapper.readTree("""
				{"nan": "NaN", "inf": "Infinity", "negInf": "-Infinity", "huge": 1e400}
				""");

		assertThat(LlmJson.doubleOrNull(node, "nan")).isNull();
		assertThat(LlmJson.doubleOrNull(node, "inf")).isNull();
		assertThat(LlmJson.doubleOrNull(node, "negInf")).isNull();
		assertThat(LlmJson.doubleOrNull(node, "huge")).isNull();
		assertThat(LlmJson.integerOrNull(node, "nan")).isNull();
	}

	@Test
	void countsOutsideIntRangeAreUnknown() throws Exception {
		JsonNode node = objectMapper.readTree("""
				{"large": 3000000000, "negative": -3000000000, "max": 2147483647}
				""");

		assertThat(LlmJson.integerOrNull(node, "large")).isNull();
		assertThat(LlmJson.integerOrNull(node, "negative")).isNull();
		assertThat(LlmJson.integerOrNull(node, "max")).isEqualTo(Integer.MAX_VALUE);
	}

	@Test
	void schemaViolationsAreInvalidOutput() throws Exception {
		JsonSchema schema = LlmJson.compileSchema(objectMapper, """
				{"type": "object", "additionalProperties": false, "required": ["count"],
				 "properties": {"count": {"type": "number"}}}
				""", "test");

		LlmJson.requireSchemaMatch(schema, objectMapper.readTree("{\"count\": 2}"), "bad_output", "Test");
		assertThatThrownBy(() -> LlmJson.requireSchemaMatch(schema, objectMapper.readTree("{}"), "bad_output", "Test"))
				.isInstanceOfSatisfying(LlmOutputException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo("bad_output"))
				.hasMessageContaining("Test JSON did not match schema");
		assertThatThrownBy(() -> LlmJson.requireSchemaMatch(schema,
				objectMapper.readTree("{\"count\": \"NaN\"}"), "bad_output", "Test"))
				.isInstanceOf(LlmOutputException.class);
		assertThatThrownBy(() -> LlmJson.requireSchemaMatch(schema,
				objectMapper.readTree("{\"count\": 1, \"extra\": true}"), "bad_output", "Test"))
				.isInstanceOf(LlmOutputException.class);
	}

	@Test
	void textAndListReadersSkipBlanks() throws Exception {
		JsonNode node = objectMapper.readTree("""
				{"name": "  Jane  ", "empty": " ", "flags": ["Overdraft", "", null, " Gambling "], "obj": {"x": 1}}
				""");

		assertThat(LlmJson.textOrNull(node, "name")).isEqualTo("Jane");
		assertThat(LlmJson.textOrNull(node, "empty")).isNull();
		assertThat(LlmJson.textOrNull(node, "obj")).isNull();
		assertThat(LlmJson.stringList(node, "flags")).containsExactly("Overdraft", "Gambling");
		assertThat(LlmJson.stringList(node, "name")).isEmpty();
	}

	@Test
	void enumReaderNormalizesSpelling() throws Exception {
		JsonNode node = objectMapper.readTree("""
				{"goal": "personal loan", "other": "space travel"}
				""");

		assertThat(LlmJson.enumOrNull(Goal.class, node, "goal")).isEqualTo(Goal.PERSONAL_LOAN);
		assertThat(LlmJson.enumOrNull(Goal.class, node, "other")).isNull();
	}
}
