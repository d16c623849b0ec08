package com.ticketflow.orchestrator.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings, bound from {@code ticketflow.engine.*} in application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "ticketflow.engine")
public class EngineProperties {

    /** Root directory holding one sub-directory per run. */
    @NotNull
    private Path runsDir = Path.of("runs");

    /** Maximum number of non-terminal runs; further submissions are rejected. */
    @Min(1)
    private int maxConcurrentRuns = 2;

    /** Wall-clock budget of a step unless its descriptor overrides it. */
    @NotNull
    private Duration defaultStepTimeout = Duration.ofHours(1);

    /** How long a timed-out process tree gets to exit after a polite destroy. */
    @NotNull
    private Duration killGracePeriod = Duration.ofSeconds(10);

    /** Interpreter used for the external Python programs ({python} placeholder). */
    @NotBlank
    private String pythonExecutable = "python3";

    /** Directory holding the external programs ({scripts_dir} placeholder). */
    @NotNull
    private Path scriptsDir = Path.of(".");

    /** Upper bound on the bytes returned by one log read. */
    @Min(1024)
    private int logChunkBytes = 64 * 1024;

    /** Extra environment variables passed to every external program. */
    @NotNull
    private Map<String, String> environment = new LinkedHashMap<>();

    /** Jira projects a run may target. */
    @NotEmpty
    private List<String> jiraProjects = List.of("SUP", "TMS");

    public Path getRunsDir()                         { return runsDir; }
    public void setRunsDir(Path runsDir)             { this.runsDir = runsDir; }
    public int  getMaxConcurrentRuns()               { return maxConcurrentRuns; }
    public void setMaxConcurrentRuns(int v)          { this.maxConcurrentRuns = v; }
    public Duration getDefaultStepTimeout()          { return defaultStepTimeout; }
    public void setDefaultStepTimeout(Duration v)    { this.defaultStepTimeout = v; }
    public Duration getKillGracePeriod()             { return killGracePeriod; }
    public void setKillGracePeriod(Duration v)       { this.killGracePeriod = v; }
    public String getPythonExecutable()              { return pythonExecutable; }
    public void setPythonExecutable(String v)        { this.pythonExecutable = v; }
    public Path getScriptsDir()                      { return scriptsDir; }
    public void setScriptsDir(Path scriptsDir)       { this.scriptsDir = scriptsDir; }
    public int  getLogChunkBytes()                   { return logChunkBytes; }
    public void setLogChunkBytes(int v)              { this.logChunkBytes = v; }
    public Map<String, String> getEnvironment()      { return environment; }
    public void setEnvironment(Map<String, String> v){ this.environment = v; }
    public List<String> getJiraProjects()            { return jiraProjects; }
    public void setJiraProjects(List<String> v)      { this.jiraProjects = v; }
}
