package com.autopilot.scheduler.service;

import com.autopilot.config.SchedulerProperties;
import com.autopilot.scheduler.model.JobDefinition;
import com.autopilot.scheduler.model.JobExecution;
import com.autopilot.scheduler.model.JobStatus;
import com.autopilot.scheduler.model.TriggerKind;
import com.autopilot.scheduler.repository.JobExecutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerCatchUpTest {

    @Mock
    private JobExecutionRepository jobExecutionRepository;

    @Mock
    private AgentScheduler agentScheduler;

    private SchedulerProperties properties;
    private SchedulerCatchUp catchUp;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        // 2025-03-10 08:00 в Париже (понедельник)
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T07:00:00Z"), ZoneOffset.UTC);
        catchUp = new SchedulerCatchUp(new JobCatalog(properties), jobExecutionRepository, agentScheduler,
                properties, clock);
    }

    private static Optional<JobExecution> lastFired(String jobId, LocalDateTime firedAt) {
        return Optional.of(JobExecution.builder()
                .jobId(jobId)
                .triggerKind(TriggerKind.SCHEDULED)
                .firedAt(firedAt)
                .status(JobStatus.COMPLETED)
                .build());
    }

    @Test
    void shouldFireMissedJobOnceAfterLongDowntime() {
        // Arrange
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc(any())).thenReturn(Optional.empty());
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc("cash_predictability"))
                .thenReturn(lastFired("cash_predictability", LocalDateTime.of(2025, 3, 5, 5, 0)));

        // Act
        int fired = catchUp.runMissedJobs();

        // Assert
        assertEquals(1, fired);
        verify(agentScheduler, times(1)).fire(argThat((JobDefinition job) -> job.id().equals("cash_predictability")),
                eq(TriggerKind.CATCH_UP));
    }

    @Test
    void shouldNotFireJobThatRanOnTime() {
        // Arrange
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc(any())).thenReturn(Optional.empty());
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc("revenue_velocity"))
                .thenReturn(lastFired("revenue_velocity", LocalDateTime.of(2025, 3, 10, 6, 0)));

        // Act
        int fired = catchUp.runMissedJobs();

        // Assert
        assertEquals(0, fired);
        verify(agentScheduler, never()).fire(any(JobDefinition.class), any());
    }

    @Test
    void shouldNotCatchUpJobsThatNeverRan() {
        // Arrange
        when(jobExecutionRepository.findFirstByJobIdOrderByFiredAtDesc(any())).thenReturn(Optional.empty());

        // Act & Assert
        assertEquals(0, catchUp.runMissedJobs());
        verifyNoInteractions(agentScheduler);
    }

    @Test
    void shouldDoNothingWhenCatchUpDisabled() {
        // Arrange
        properties.setCatchUpEnabled(false);

        // Act
        catchUp.onApplicationReady();

        // Assert
        verifyNoInteractions(jobExecutionRepository, agentScheduler);
    }
}
