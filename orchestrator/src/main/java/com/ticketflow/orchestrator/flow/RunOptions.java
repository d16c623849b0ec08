package com.ticketflow.orchestrator.flow;

/**
 * Per-run flags that steer the skip policy and the flow layout.
 *
 * @param skipExisting      skip steps whose declared outputs already validate
 * @param overwrite         always run every step; wins over skipExisting
 * @param append            use the append variant of steps that support it
 * @param skipDeduplication leave the Jira deduplication step out of the run
 * @param seedFromRunId     finished run whose artifacts are copied into the new run directory, or null
 */
public record RunOptions(
        boolean skipExisting,
        boolean overwrite,
        boolean append,
        boolean skipDeduplication,
        String  seedFromRunId) {

    public static RunOptions defaults() {
        return new RunOptions(true, false, false, false, null);
    }

    /** Same options, with a seed run. */
    public RunOptions seededFrom(String runId) {
        return new RunOptions(skipExisting, overwrite, append, skipDeduplication, runId);
    }
}
