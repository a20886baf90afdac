package com.apogee.runner;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.apogee.config.PipelineProperties;
import com.apogee.dto.pipeline.BatchResult;
import com.apogee.exception.QueueUnavailableException;
import com.apogee.scheduler.PipelineScheduler;
import com.apogee.service.PipelineOrchestrator;
import com.apogee.service.startup.EnvironmentCheckService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class PipelineCommandLineRunnerTest {

    @Mock private PipelineOrchestrator orchestrator;
    @Mock private PipelineScheduler scheduler;
    @Mock private EnvironmentCheckService environmentCheckService;

    private PipelineProperties properties;
    private PipelineCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        runner =
                new PipelineCommandLineRunner(
                        orchestrator, scheduler, environmentCheckService, properties);
    }

    @Test
    @DisplayName("--once exits 0 when the batch completes, item failures included")
    void testOnceSuccess() {
        when(orchestrator.runBatch())
                .thenReturn(BatchResult.builder().itemsSucceeded(0).itemsFailed(2).build());

        runner.run(new DefaultApplicationArguments("--once"));

        assertEquals(0, runner.getExitCode());
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("--once exits 1 on a batch-level error")
    void testOnceFailure() {
        when(orchestrator.runBatch())
                .thenThrow(new QueueUnavailableException("topic_miner", "down", null));

        runner.run(new DefaultApplicationArguments("--once"));

        assertEquals(1, runner.getExitCode());
    }

    @Test
    @DisplayName("--check reports the environment check through the exit code")
    void testCheck() {
        when(environmentCheckService.runChecks()).thenReturn(false);

        runner.run(new DefaultApplicationArguments("--check"));

        assertEquals(1, runner.getExitCode());
        verifyNoInteractions(orchestrator, scheduler);
    }

    @Test
    @DisplayName("No flag starts the schedule")
    void testScheduleMode() {
        runner.run(new DefaultApplicationArguments());

        verify(scheduler).start();
        verifyNoInteractions(orchestrator);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    @DisplayName("A disabled schedule starts nothing")
    void testScheduleDisabled() {
        properties.getSchedule().setEnabled(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(scheduler, orchestrator);
    }

    @Test
    @DisplayName("One-shot detection looks at the raw arguments")
    void testIsOneShot() {
        assertTrue(PipelineCommandLineRunner.isOneShot(new String[] {"--once"}));
        assertTrue(PipelineCommandLineRunner.isOneShot(new String[] {"--verbose", "--check"}));
        assertFalse(PipelineCommandLineRunner.isOneShot(new String[] {}));
        assertFalse(PipelineCommandLineRunner.isOneShot(new String[] {"--onceish"}));
    }
}
