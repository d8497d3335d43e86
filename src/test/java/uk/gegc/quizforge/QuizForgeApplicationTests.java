package uk.gegc.quizforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.testsupport.TestQuestions;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("QuizForge application against a stubbed Gemini API")
class QuizForgeApplicationTests {

    private static final String GENERATE_PATH = "/models/gemini-test:generateContent";
    private static final String TEXT = "Mitochondria produce most of the energy a cell needs, while chloroplasts "
            + "let plants absorb carbon dioxide and turn light into sugar.";

    private static final WireMockServer WIRE_MOCK = new WireMockServer(WireMockConfiguration.options().dynamicPort());

    static {
        WIRE_MOCK.start();
    }

    @DynamicPropertySource
    static void providerProperties(DynamicPropertyRegistry registry) {
        registry.add("quizforge.providers.entries.gemini.api-key", () -> "test-key");
        registry.add("quizforge.providers.entries.gemini.base-url", WIRE_MOCK::baseUrl);
        registry.add("quizforge.providers.entries.gemini.models", () -> "gemini-test");
        registry.add("quizforge.generation.quality.enabled", () -> "false");
        registry.add("quizforge.generation.balance.enabled", () -> "false");
    }

    @AfterAll
    static void stopWireMock() {
        WIRE_MOCK.stop();
    }

    @Autowired
    private MockMvc mockMvc;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void stubGemini() {
        WIRE_MOCK.resetAll();
        String questions = TestQuestions.questionsJson(TestQuestions.questions(0, 2, Difficulty.EASY));
        ObjectNode response = objectMapper.createObjectNode();
        response.putArray("candidates").addObject()
                .putObject("content").putArray("parts").addObject().put("text", questions);
        WIRE_MOCK.stubFor(WireMock.post(urlPathEqualTo(GENERATE_PATH))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody(response.toString())));
    }

    @Test
    @DisplayName("POST /api/generate runs the pipeline through the Gemini adapter")
    void generatesThroughGemini() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"%s\", \"options\": {\"numQuestions\": 2, \"noCache\": true}}"
                                .formatted(TEXT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questions.length()").value(2))
                .andExpect(jsonPath("$.questions[0].questiontext").value("Which organelle produces most cellular energy?"))
                .andExpect(jsonPath("$.metadata.provider").value("gemini"))
                .andExpect(jsonPath("$.metadata.model").value("gemini-test"))
                .andExpect(jsonPath("$.metadata.deduplication.duplicatesRemoved").value(0));

        WIRE_MOCK.verify(1, postRequestedFor(urlPathEqualTo(GENERATE_PATH))
                .withHeader("x-goog-api-key", equalTo("test-key")));
    }

    @Test
    @DisplayName("a queued job completes in the background")
    void completesQueuedJob() throws Exception {
        MvcResult submitted = mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"%s\", \"options\": {\"numQuestions\": 2, \"noCache\": true}}"
                                .formatted(TEXT)))
                .andExpect(status().isAccepted())
                .andReturn();
        String id = JsonPath.read(submitted.getResponse().getContentAsString(), "$.id");

        String jobStatus = "pending";
        for (int i = 0; i < 100 && !jobStatus.equals("completed") && !jobStatus.equals("failed"); i++) {
            Thread.sleep(50);
            MvcResult polled = mockMvc.perform(get("/api/jobs/{id}", id)).andReturn();
            jobStatus = JsonPath.read(polled.getResponse().getContentAsString(), "$.status");
        }

        assertThat(jobStatus).isEqualTo("completed");
        mockMvc.perform(get("/api/jobs/{id}", id))
                .andExpect(jsonPath("$.progress").value(100))
                .andExpect(jsonPath("$.result.questions.length()").value(2));
    }

    @Test
    @DisplayName("GET /api/status reports the current provider")
    void reportsStatus() throws Exception {
        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentProvider").value("gemini"))
                .andExpect(jsonPath("$.parallel.threshold").value(20));
    }
}
