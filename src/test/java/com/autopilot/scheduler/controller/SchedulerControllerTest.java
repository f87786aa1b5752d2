package com.autopilot.scheduler.controller;

import com.autopilot.agent.model.AgentType;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobExecution;
import com.autopilot.scheduler.model.JobKind;
import com.autopilot.scheduler.model.JobStatus;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.repository.JobExecutionRepository;
import com.autopilot.scheduler.service.AgentScheduler;
import com.autopilot.scheduler.service.JobCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SchedulerController.class)
class SchedulerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobCatalog jobCatalog;

    @MockBean
    private AgentScheduler agentScheduler;

    @MockBean
    private JobExecutionRepository jobExecutionRepository;

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-03-10T03:00:00Z"), ZoneOffset.UTC);
        }
    }

    @BeforeEach
    void setUp() {
        when(jobCatalog.zone()).thenReturn(ZoneId.of("Europe/Paris"));
    }

    @Test
    void shouldListJobsWithNextFiring() throws Exception {
        // Arrange
        when(jobCatalog.jobs()).thenReturn(List.of(
                JobDefinition.agent(AgentType.CASH_PREDICTABILITY, "0 0 5 * * *"),
                JobDefinition.of(JobCatalog.WEEKLY_REPORT_JOB, JobKind.WEEKLY_REPORT, null, "0 30 6 * * MON")));
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc("cash_predictability"))
                .thenReturn(Optional.empty());

        // Act & Assert
        mockMvc.perform(get("/scheduler/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("cash_predictability"))
                .andExpect(jsonPath("$[0].zone").value("Europe/Paris"))
                .andExpect(jsonPath("$[0].nextFireAt").value("2025-03-10T05:00:00"))
                .andExpect(jsonPath("$[0].agent").value("cash_predictability"))
                .andExpect(jsonPath("$[1].kind").value("WEEKLY_REPORT"))
                .andExpect(jsonPath("$[1].agent").doesNotExist())
                .andExpect(jsonPath("$[1].nextFireAt").value("2025-03-10T06:30:00"));
    }

    @Test
    void shouldRunJobManually() throws Exception {
        // Arrange
        JobExecution execution = JobExecution.builder()
                .id(UUID.randomUUID())
                .jobId("router")
                .triggerKind(TriggerKind.MANUAL)
                .firedAt(LocalDateTime.of(2025, 3, 10, 5, 0))
                .finishedAt(LocalDateTime.of(2025, 3, 10, 5, 1))
                .tenantsProcessed(3)
                .tenantsFailed(0)
                .status(JobStatus.COMPLETED)
                .build();
        when(agentScheduler.fire("router", TriggerKind.MANUAL)).thenReturn(Optional.of(execution));

        // Act & Assert
        mockMvc.perform(post("/scheduler/jobs/router/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.tenantsProcessed").value(3));
    }

    @Test
    void shouldReturnConflictWhenJobIsRunning() throws Exception {
        // Arrange
        when(agentScheduler.fire("router", TriggerKind.MANUAL)).thenReturn(Optional.empty());

        // Act & Assert
        mockMvc.perform(post("/scheduler/jobs/router/run"))
                .andExpect(status().isConflict());
    }
}
