package com.apogee.runner;

import com.apogee.config.PipelineProperties;
import com.apogee.dto.pipeline.BatchResult;
import com.apogee.scheduler.PipelineScheduler;
import com.apogee.service.PipelineOrchestrator;
import com.apogee.service.startup.EnvironmentCheckService;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Chooses the run mode from the command line: {@code --once} runs one batch, {@code --check} runs
 * the environment check, no flag starts the recurring schedule. The one-shot modes report their
 * outcome through the process exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String ONCE = "once";
    public static final String CHECK = "check";

    private final PipelineOrchestrator orchestrator;
    private final PipelineScheduler scheduler;
    private final EnvironmentCheckService environmentCheckService;
    private final PipelineProperties properties;

    private volatile int exitCode = 0;

    public static boolean isOneShot(String[] args) {
        return Arrays.stream(args).anyMatch(a -> a.equals("--" + ONCE) || a.equals("--" + CHECK));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(CHECK)) {
            exitCode = environmentCheckService.runChecks() ? 0 : 1;
            return;
        }

        if (args.containsOption(ONCE)) {
            log.info("Mode --once: running the pipeline now");
            exitCode = runOnce();
            return;
        }

        if (!properties.getSchedule().isEnabled()) {
            log.info("Schedule disabled, no batch will run");
            return;
        }
        log.info(
                "Starting scheduler (PIPELINE_SCHEDULE='{}')", properties.getSchedule().getCron());
        scheduler.start();
    }

    private int runOnce() {
        try {
            BatchResult result = orchestrator.runBatch();
            if (result.isNotStarted()) {
                log.error("Another batch is already running");
                return 1;
            }
            log.info(
                    "Pipeline finished: {} video(s) approved, {} failed, {} skipped",
                    result.getItemsSucceeded(),
                    result.getItemsFailed(),
                    result.getItemsSkipped());
            return 0;
        } catch (Exception e) {
            log.error("Pipeline run failed: {}", e.getMessage());
            return 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
