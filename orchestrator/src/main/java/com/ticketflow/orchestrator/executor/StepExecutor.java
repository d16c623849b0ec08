package com.ticketflow.orchestrator.executor;

import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.runlog.RunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one external program to completion or timeout.
 *
 * The child's working directory is the run directory; stdout and stderr are
 * merged and forwarded line by line to the run log while the program runs.
 * On timeout the whole process tree is destroyed, politely first and
 * forcibly after the configured grace period.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final EngineProperties properties;

    public StepExecutor(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Launch {@code command} in {@code runDirectory} and block until it ends.
     *
     * @throws ExecutorException if the program cannot be started or the waiting thread is interrupted
     */
    public StepOutcome execute(List<String> command, Path runDirectory, Duration timeout, RunLog runLog) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(runDirectory.toFile())
                .redirectErrorStream(true)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));

        Map<String, String> env = pb.environment();
        env.putAll(properties.getEnvironment());
        env.put("PYTHONUNBUFFERED", "1");
        env.put("PYTHONIOENCODING", "utf-8");

        long started = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutorException(command.get(0), "Failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        }
        log.debug("Started pid {} in {}: {}", process.pid(), runDirectory, command);

        AtomicBoolean detached = new AtomicBoolean();
        Thread reader = new Thread(() -> forwardOutput(process, runLog, detached),
                "step-output-" + runLog.getRunId());
        reader.setDaemon(true);
        reader.start();

        boolean timedOut = false;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                runLog.error("Timeout after " + timeout.toSeconds() + "s, terminating process tree");
                destroyTree(process);
            }
            reader.join(properties.getKillGracePeriod().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new ExecutorException(command.get(0), "Interrupted while waiting for " + command.get(0), e);
        }
        if (reader.isAlive()) {
            detached.set(true);
            log.warn("Output of pid {} still open after exit; a descendant may hold the pipe", process.pid());
            runLog.warn("Output still open after the program ended; later output of this step is not logged");
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        int exitCode = process.isAlive() ? -1 : process.exitValue();
        return new StepOutcome(exitCode, timedOut, elapsed);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Forward lines to the run log until {@code detached} is set, then only to debug logging. */
    private void forwardOutput(Process process, RunLog runLog, AtomicBoolean detached) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (detached.get()) {
                    log.debug("Late output of pid {}: {}", process.pid(), line);
                } else {
                    runLog.output(line);
                }
            }
        } catch (IOException e) {
            log.warn("Output stream of pid {} closed: {}", process.pid(), e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("Could not write output of pid {} to the run log: {}", process.pid(), e.getMessage(), e);
        }
    }

    /** Descendants first, so none are re-parented out of reach. */
    void destroyTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(properties.getKillGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("pid {} ignored termination, killing forcibly", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        if (process.isAlive()) {
            process.destroyForcibly();
            try {
                process.waitFor(properties.getKillGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
