package my.suitabilityadvisor.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.suitabilityadvisor.app.AppApplication;
import my.suitabilityadvisor.app.domain.EvaluationResult;
import my.suitabilityadvisor.app.service.IntakeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = AppApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AnalysisApiIntegrationTest {
	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private ObjectMapper objectMapper;

	@Autowired
	private IntakeService intakeService;

	@BeforeEach
	void setUp() {
		intakeService.clear();
	}

	@Test
	void runIsRejectedUntilIntakeIsComplete() throws Exception {
		mockMvc.perform(post("/api/analysis/run"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Intake incomplete"))
				.andExpect(jsonPath("$.missing[0]").value("country_of_residence"))
				.andExpect(jsonPath("$.missing[3]").value("INDIVIDUAL_BANK_STATEMENT"))
				.andExpect(jsonPath("$.path").value("/api/analysis/run"));

		mockMvc.perform(get("/api/analysis/status"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("IDLE"));
	}

	@Test
	void completeIntakeRunsToSuccessWithOfflineCollaborators() throws Exception {
		mockMvc.perform(put("/api/session/manual-fields")
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"customer_type": "INDIVIDUAL", "name": "Jane Doe", "citizenship": "DE",
								 "country_of_residence": "AE", "goal": "CREDIT_CARD"}
								"""))
				.andExpect(status().isOk());
		upload("statement.pdf", "application/pdf", "INDIVIDUAL_BANK_STATEMENT");
		upload("payslip.pdf", "application/pdf", "PAYSLIP");
		upload("passport.png", "image/png", "ID_DOCUMENT");

		String started = mockMvc.perform(post("/api/analysis/run"))
				.andExpect(status().isAccepted())
				.andExpect(jsonPath("$.status").value("RUNNING"))
				.andReturn().getResponse().getContentAsString();
		long runId = objectMapper.readTree(started).path("run_id").asLong();

		JsonNode finalStatus = awaitTerminalStatus();
		assertThat(finalStatus.path("status").asText()).isEqualTo("SUCCESS");
		assertThat(finalStatus.path("run_id").asLong()).isEqualTo(runId);
		assertThat(finalStatus.path("progress").asInt()).isEqualTo(100);
		assertThat(finalStatus.path("stage").asText()).isEqualTo("COMPLETED");

		String session = mockMvc.perform(get("/api/session"))
				.andExpect(status().isOk())
				.andReturn().getResponse().getContentAsString();
		JsonNode root = objectMapper.readTree(session);
		assertThat(root.path("profile").path("name").asText()).isEqualTo("Jane Doe");
		JsonNode evaluations = root.path("evaluations");
		assertThat(evaluations.size()).isEqualTo(2);
		assertThat(evaluations.get(0).path("product_id").asText()).isEqualTo("prod_cc_001");
		assertThat(evaluations.get(1).path("product_id").asText()).isEqualTo("prod_pl_001");
		for (JsonNode evaluation : evaluations) {
			assertThat(evaluation.path("customer_explanation").asText()).isNotEqualTo(EvaluationResult.PENDING_EXPLANATION);
			assertThat(evaluation.path("advisor_explanation").asText()).isNotEqualTo(EvaluationResult.PENDING_EXPLANATION);
			// no age was extracted, so the minimum age check fails
			assertThat(evaluation.path("eligible").asBoolean()).isFalse();
			assertThat(evaluation.path("decision").asText()).isEqualTo("DECLINE");
		}
	}

	@Test
	void cancelWithoutRunReturnsIdleState() throws Exception {
		mockMvc.perform(post("/api/analysis/cancel"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("IDLE"))
				.andExpect(jsonPath("$.progress").value(0));
	}

	private void upload(String name, String mimeType, String slot) throws Exception {
		MockMultipartFile file = new MockMultipartFile("files", name, mimeType, name.getBytes(StandardCharsets.UTF_8));
		mockMvc.perform(multipart("/api/session/documents").file(file).param("slot", slot))
				.andExpect(status().isOk());
	}

	private JsonNode awaitTerminalStatus() throws Exception {
		long deadline = System.currentTimeMillis() + 10_000;
		while (System.currentTimeMillis() < deadline) {
			String body = mockMvc.perform(get("/api/analysis/status"))
					.andExpect(status().isOk())
					.andReturn().getResponse().getContentAsString();
			JsonNode node = objectMapper.readTree(body);
			String current = node.path("status").asText();
			if (!"RUNNING".equals(current)) {
				return node;
			}
			Thread.sleep(50);
		}
		fail("Analysis run did not finish in time");
		return null;
	}
}
