package uk.gegc.quizforge.features.job.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.job.application.GenerationJobQueue;
import uk.gegc.quizforge.features.job.application.GenerationJobStore;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;
import uk.gegc.quizforge.features.job.domain.model.JobStatus;
import uk.gegc.quizforge.shared.exception.JobException;
import uk.gegc.quizforge.shared.exception.JobNotFoundException;
import uk.gegc.quizforge.testsupport.TestQuestions;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(JobMapper.class)
@DisplayName("JobController")
class JobControllerTest {

    private static final String TEXT = "Glaciers carve U-shaped valleys as they slowly move downhill under their own weight.";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GenerationJobQueue jobQueue;

    @MockitoBean
    private GenerationJobStore jobStore;

    private static GenerationJob job(JobStatus status, int progress) {
        GenerationJob job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(status);
        job.setProgress(progress);
        job.setCreatedAt(Instant.parse("2026-06-01T10:00:00Z"));
        return job;
    }

    @Test
    @DisplayName("POST /api/jobs accepts the job and returns it pending")
    void submit() throws Exception {
        GenerationJob pending = job(JobStatus.PENDING, 0);
        when(jobQueue.submit(eq(TEXT), any())).thenReturn(pending);

        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"%s\", \"options\": {\"numQuestions\": 30}}".formatted(TEXT)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(pending.getId().toString()))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.progress").value(0))
                .andExpect(jsonPath("$.createdAt").value("2026-06-01T10:00:00Z"));
    }

    @Test
    @DisplayName("POST /api/jobs without text is 400")
    void submitWithoutText() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(jobQueue, never()).submit(any(), any());
    }

    @Test
    @DisplayName("GET /api/jobs/{id} includes the result of a completed job")
    void getCompleted() throws Exception {
        GenerationJob completed = job(JobStatus.COMPLETED, 100);
        when(jobStore.get(completed.getId())).thenReturn(completed);
        when(jobStore.readResult(completed))
                .thenReturn(TestQuestions.questionSet(TestQuestions.questions(0, 2, Difficulty.MEDIUM), "gemini"));

        mockMvc.perform(get("/api/jobs/{id}", completed.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.progress").value(100))
                .andExpect(jsonPath("$.result.questions.length()").value(2));
    }

    @Test
    @DisplayName("GET /api/jobs/{id} for an unknown job is 404")
    void getUnknown() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobStore.get(id)).thenThrow(new JobNotFoundException(id));

        mockMvc.perform(get("/api/jobs/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Job Not Found"));
    }

    @Test
    @DisplayName("GET /api/jobs/{id} with a malformed id is 400")
    void getMalformedId() throws Exception {
        mockMvc.perform(get("/api/jobs/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("id"));
    }

    @Test
    @DisplayName("GET /api/jobs filters by status")
    void listByStatus() throws Exception {
        when(jobStore.findByStatus(JobStatus.RUNNING)).thenReturn(List.of(job(JobStatus.RUNNING, 40)));

        mockMvc.perform(get("/api/jobs").param("status", "running"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].progress").value(40));
    }

    @Test
    @DisplayName("GET /api/jobs with an unknown status is 400")
    void listUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/jobs").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unknown job status: paused"));
    }

    @Test
    @DisplayName("DELETE /api/jobs/{id} on a running job is 409")
    void cancelRunning() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobQueue.cancel(id)).thenThrow(
                new JobException("Only pending jobs can be cancelled; job " + id + " is running"));

        mockMvc.perform(delete("/api/jobs/{id}", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Illegal Job State"));
    }

    @Test
    @DisplayName("DELETE /api/jobs/finished uses the default retention")
    void clearFinished() throws Exception {
        when(jobStore.clearFinished(Duration.ofHours(24))).thenReturn(3);

        mockMvc.perform(delete("/api/jobs/finished"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));
    }
}
