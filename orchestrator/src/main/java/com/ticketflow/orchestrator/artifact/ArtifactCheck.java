package com.ticketflow.orchestrator.artifact;

/**
 * Verdict of the {@link ArtifactValidator} for one path.
 *
 * @param path   the path as declared (relative to the run directory)
 * @param valid  true when the artifact is present and well-formed
 * @param reason why the artifact was rejected; null when valid
 */
public record ArtifactCheck(String path, boolean valid, String reason) {

    public static ArtifactCheck ok(String path) {
        return new ArtifactCheck(path, true, null);
    }

    public static ArtifactCheck rejected(String path, String reason) {
        return new ArtifactCheck(path, false, reason);
    }

    @Override
    public String toString() {
        return valid ? path + " (ok)" : path + " (" + reason + ")";
    }
}
