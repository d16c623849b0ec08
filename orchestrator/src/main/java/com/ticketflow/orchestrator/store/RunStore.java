package com.ticketflow.orchestrator.store;

import com.ticketflow.orchestrator.model.RunSnapshot;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable record of every run: its directory, status snapshot and log.
 *
 * Writes for one run are serialized; reads never block on them and never
 * observe a partially written snapshot.
 */
public interface RunStore {

    /** Directory a run with this id lives in. Does not create it. */
    Path runDirectory(String runId);

    /**
     * Create the run directory with {@code params.json}, {@code status.json},
     * an empty {@code run.log} and an {@code artifacts/} directory.
     *
     * @param seedFromRunId run whose {@code artifacts/} tree is copied into the new run directory, or null
     * @throws RunNotFoundException if the seed run is unknown
     */
    void create(RunSnapshot initial, String seedFromRunId);

    /** Replace the run's status snapshot. */
    void save(RunSnapshot snapshot);

    /** Append already formatted text to the run log. */
    void appendLog(String runId, String text);

    /**
     * Copy validated outputs into the run's {@code artifacts/} directory,
     * keeping their relative paths.
     *
     * @return the artifact paths relative to the run directory
     */
    List<String> captureArtifacts(String runId, List<String> declaredOutputs);

    /** Read the log from a byte offset, at most one chunk. */
    LogChunk readLog(String runId, long fromOffset);

    RunSnapshot getStatus(String runId);

    boolean exists(String runId);

    /** All known runs, newest first. */
    List<RunSnapshot> listRuns();

    List<ArtifactEntry> listArtifacts(String runId);
}
