package com.ticketflow.orchestrator.runlog;

import com.ticketflow.orchestrator.store.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Writer for one run's {@code run.log}.
 *
 * Engine messages are written as {@code [timestamp] [LEVEL] message}, child
 * output as {@code [timestamp] line}. Every line is redacted before it reaches
 * the store. Lines are mirrored to SLF4J at debug level.
 *
 * The last few lines of child output are kept in memory so a failure can be
 * summarized without re-reading the log.
 */
public class RunLog {

    private static final Logger log = LoggerFactory.getLogger(RunLog.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final int TAIL_LINES = 20;

    private final RunStore store;
    private final String   runId;
    private final Clock    clock;

    private final Deque<String> tail = new ArrayDeque<>(TAIL_LINES);

    public RunLog(RunStore store, String runId, Clock clock) {
        this.store = store;
        this.runId = runId;
        this.clock = clock;
    }

    public void info(String message)  { write("INFO", message); }
    public void warn(String message)  { write("WARN", message); }
    public void error(String message) { write("ERROR", message); }

    /** Log the command line about to be launched. */
    public void command(List<String> command) {
        info("Command: " + String.join(" ", command));
    }

    /** One line of merged child output. */
    public void output(String line) {
        String safe = SecretRedactor.redact(line);
        append("[" + now() + "] " + safe);
        log.debug("[{}] {}", runId, safe);
        synchronized (tail) {
            if (tail.size() == TAIL_LINES) tail.removeFirst();
            tail.addLast(safe);
        }
    }

    /** The most recent child output lines, oldest first. */
    public List<String> recentOutput() {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }

    /** Forget buffered output; called when a new step starts. */
    public void clearRecentOutput() {
        synchronized (tail) {
            tail.clear();
        }
    }

    public void stepStart(String stepName) {
        info("=== STEP START: " + stepName + " ===");
    }

    public void stepEnd(String stepName, boolean success) {
        info("=== STEP END: " + stepName + " - " + (success ? "SUCCESS" : "FAILED") + " ===");
    }

    public String getRunId() { return runId; }

    private void write(String level, String message) {
        String safe = SecretRedactor.redact(message);
        append("[" + now() + "] [" + level + "] " + safe);
        log.debug("[{}] [{}] {}", runId, level, safe);
    }

    private void append(String line) {
        store.appendLog(runId, line + "\n");
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }
}
