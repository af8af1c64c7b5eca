package net.jobsy.app.web;

import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobDefinition;
import net.jobsy.core.spi.Clock;
import net.jobsy.core.spi.JobRepository;
import net.jobsy.core.spi.Notifier;
import net.jobsy.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class JobControllerTest {
    private static final Instant T1 = Instant.parse("2024-03-01T10:30:00Z");

    @Autowired MockMvc mvc;
    @Autowired JobRepository jobs;
    @Autowired TxRunner tx;

    @MockBean Notifier notifier;
    @MockBean Clock clock;

    @BeforeEach
    void setUp() {
        when(clock.now()).thenReturn(T1);
    }

    private Job seed(String name) throws Exception {
        return tx.required(() -> jobs.upsert(new JobDefinition(
                name, "0 * * * *", 1, "ok", name + "@example.com", "https://ci.example.com/" + name, true)));
    }

    @Test
    @DisplayName("catalog jobs are registered at start-up and listed")
    void listIncludesCatalogJobs() throws Exception {
        mvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'catalog-demo')].schedule").value(hasItem("0 2 * * *")))
                .andExpect(jsonPath("$[?(@.name == 'catalog-demo')].deadline").value(hasItem(5)))
                .andExpect(jsonPath("$[?(@.name == 'catalog-demo')].owner").value(hasItem("ops@example.com")))
                .andExpect(jsonPath("$[?(@.name == 'catalog-demo')].expected_finish")
                        .value(hasItem(startsWith("2024-03-01T02:05"))))
                .andExpect(jsonPath("$[?(@.name == 'catalog-demo')].schedule_description").isNotEmpty());
    }

    @Test
    void reportThenDetail() throws Exception {
        Job job = seed("api-detail");

        mvc.perform(get("/api/jobs/{id}", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("api-detail"))
                .andExpect(jsonPath("$.url").value("https://ci.example.com/api-detail"))
                .andExpect(jsonPath("$.latest_report").value(nullValue()));

        mvc.perform(post("/api/jobs/{id}", job.id()).param("status", "ok"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));

        mvc.perform(get("/api/jobs/{id}", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latest_report.status").value("ok"))
                .andExpect(jsonPath("$.latest_report.created").value(startsWith("2024-03-01T10:30")));
    }

    @Test
    @DisplayName("missing or blank status answers 400 ERROR")
    void reportWithoutStatus() throws Exception {
        Job job = seed("api-bad-report");

        mvc.perform(post("/api/jobs/{id}", job.id()))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("ERROR"));
        mvc.perform(post("/api/jobs/{id}", job.id()).param("status", "  "))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("ERROR"));
    }

    @Test
    void unknownJob() throws Exception {
        UUID missing = UUID.randomUUID();

        mvc.perform(get("/api/jobs/{id}", missing))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NotFoundException"));
        mvc.perform(post("/api/jobs/{id}", missing).param("status", "ok"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/jobs/{id}/check", missing))
                .andExpect(status().isNotFound());
    }

    @Test
    void malformedId() throws Exception {
        mvc.perform(get("/api/jobs/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MethodArgumentTypeMismatchException"));
    }

    @Test
    @DisplayName("on-demand checks: success, one notification for the failure, then silence")
    void checkFlow() throws Exception {
        Job job = seed("api-check");
        mvc.perform(post("/api/jobs/{id}", job.id()).param("status", "ok")).andExpect(status().isOk());

        mvc.perform(post("/api/jobs/{id}/check", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SUCCESS"))
                .andExpect(jsonPath("$.workflow_check_result").value("Success"));

        Instant secondCheck = T1.plus(Duration.ofHours(1));
        when(clock.now()).thenReturn(secondCheck);
        mvc.perform(post("/api/jobs/{id}/check", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("FAIL"))
                .andExpect(jsonPath("$.last_notify").value(startsWith("2024-03-01T11:30")));
        verify(notifier, timeout(5000)).sendFailureNotification(
                argThat(j -> j.name().equals("api-check")),
                eq(secondCheck),
                eq(Instant.parse("2024-03-01T11:01:00Z")));

        when(clock.now()).thenReturn(T1.plus(Duration.ofHours(2)));
        mvc.perform(post("/api/jobs/{id}/check", job.id()))
                .andExpect(jsonPath("$.outcome").value("FAIL"));
        verify(notifier, after(300).times(1)).sendFailureNotification(
                argThat(j -> j.name().equals("api-check")), any(), any());
    }

    @Test
    void checkInsideWindow() throws Exception {
        Job job = seed("api-window");
        when(clock.now()).thenReturn(Instant.parse("2024-03-01T10:00:30Z"));

        mvc.perform(post("/api/jobs/{id}/check", job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("INSIDE_WINDOW"))
                .andExpect(jsonPath("$.workflow_check_result").value("Inside schedule deadline"))
                .andExpect(jsonPath("$.last_checked").value(nullValue()));
    }
}
