package com.ticketflow.orchestrator.flow;

import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.model.CommandTemplate;
import com.ticketflow.orchestrator.model.FlowDefinition;
import com.ticketflow.orchestrator.model.FlowKind;
import com.ticketflow.orchestrator.model.StepDescriptor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.ticketflow.orchestrator.flow.TicketFiles.*;

/**
 * Knows the two ticket flows and turns a raw request into a validated {@link FlowPlan}.
 *
 * Every external program runs with the run directory as working directory,
 * so all file arguments are relative names. The built-in placeholders
 * {@code python}, {@code scripts_dir} and {@code run_dir} are bound by the
 * run controller.
 */
@Component
public class FlowCatalog {

    static final String STEP_EXPORT_JITBIT   = "Export Jitbit Tickets";
    static final String STEP_EXPORT_KB       = "Export Jitbit Knowledge Base";
    static final String STEP_LLM             = "Process Tickets with LLM";
    static final String STEP_TICKETS_DOCX    = "Generate DOCX from Tickets";
    static final String STEP_KB_DOCX         = "Generate DOCX from Knowledge Base";
    static final String STEP_EXPORT_JIRA     = "Export Jira Tickets";
    static final String STEP_DEDUP           = "Deduplicate Tickets";

    static final int    DEFAULT_SAVE_INTERVAL       = 50;
    static final String DEFAULT_DEDUP_THRESHOLD     = "0.84";
    static final String DEFAULT_DEDUP_THRESHOLD_LOW = "0.78";

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final EngineProperties properties;

    public FlowCatalog(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Validate the request parameters and build the flow.
     *
     * @throws ParameterValidationException listing every problem found
     */
    public FlowPlan build(FlowKind kind, Map<String, ?> rawParameters, RunOptions options) {
        Map<String, ?> raw = rawParameters == null ? Map.of() : rawParameters;
        ParameterReader reader = new ParameterReader(raw);
        return switch (kind) {
            case JITBIT -> jitbit(reader, options);
            case JIRA   -> jira(reader, options);
        };
    }

    // ------------------------------------------------------------------
    // Jitbit
    // ------------------------------------------------------------------

    private FlowPlan jitbit(ParameterReader in, RunOptions options) {
        in.positiveInt("start_id", true);
        in.positiveInt("llm_limit", false);
        in.positiveInt("llm_max_calls", false);
        in.positiveInt("llm_save_interval", false);
        in.bool("newest_first");
        in.throwIfInvalid();
        in.values.putIfAbsent("llm_save_interval", String.valueOf(DEFAULT_SAVE_INTERVAL));

        List<StepDescriptor> steps = List.of(
                StepDescriptor.builder(STEP_EXPORT_JITBIT,
                                script(SCRIPT_JITBIT_EXPORT)
                                        .arg("--start-id", "{start_id}")
                                        .arg("--yes")
                                        .build())
                        .produces(JITBIT_EXPORT)
                        .build(),
                StepDescriptor.builder(STEP_EXPORT_KB,
                                script(SCRIPT_JITBIT_KB_EXPORT)
                                        .arg("--out", JITBIT_KB_EXPORT)
                                        .arg("--yes")
                                        .build())
                        .produces(JITBIT_KB_EXPORT)
                        .build(),
                StepDescriptor.builder(STEP_LLM,
                                script(SCRIPT_LLM_PROCESS)
                                        .arg("--input", JITBIT_EXPORT)
                                        .arg("--output", JITBIT_LLM_OUTPUT)
                                        .arg("--not-relevant-out", JITBIT_NOT_RELEVANT)
                                        .optional("--limit", "{llm_limit}")
                                        .optional("--max-calls", "{llm_max_calls}")
                                        .flag("--newest-first", "newest_first")
                                        .arg("--save-interval", "{llm_save_interval}")
                                        .appendVariant("--append")
                                        .build())
                        .requires(JITBIT_EXPORT)
                        .produces(JITBIT_LLM_OUTPUT, JITBIT_NOT_RELEVANT)
                        .supportsAppend()
                        .build(),
                StepDescriptor.builder(STEP_TICKETS_DOCX,
                                script(SCRIPT_TICKETS_TO_DOCX)
                                        .arg("--input", JITBIT_LLM_OUTPUT)
                                        .arg("--output-dir", stripSlash(JITBIT_DOCX_DIR))
                                        .arg("--verbose", "true")
                                        .build())
                        .requires(JITBIT_LLM_OUTPUT)
                        .produces(JITBIT_DOCX_DIR)
                        .build(),
                StepDescriptor.builder(STEP_KB_DOCX,
                                script(SCRIPT_KB_TO_DOCX)
                                        .arg("--input", JITBIT_KB_EXPORT)
                                        .arg("--output", JITBIT_KB_DOCX)
                                        .build())
                        .requires(JITBIT_KB_EXPORT)
                        .produces(JITBIT_KB_DOCX)
                        .build());

        return new FlowPlan(new FlowDefinition(FlowKind.JITBIT, steps), new RunParameters(in.values, options));
    }

    // ------------------------------------------------------------------
    // Jira
    // ------------------------------------------------------------------

    private FlowPlan jira(ParameterReader in, RunOptions options) {
        in.project("project", properties.getJiraProjects());
        LocalDate after  = in.date("resolved_after", true);
        LocalDate before = in.date("resolved_before", false);
        if (after != null && before != null && before.isBefore(after)) {
            in.problem("resolved_before must not be earlier than resolved_after");
        }
        in.positiveInt("jira_limit", false);
        in.positiveInt("llm_limit", false);
        in.positiveInt("llm_max_calls", false);
        Double high = in.threshold("dedup_threshold");
        Double low  = in.threshold("dedup_threshold_low");
        in.bool("progress");
        in.throwIfInvalid();

        double effectiveHigh = high != null ? high : Double.parseDouble(DEFAULT_DEDUP_THRESHOLD);
        double effectiveLow  = low  != null ? low  : Double.parseDouble(DEFAULT_DEDUP_THRESHOLD_LOW);
        if (effectiveLow > effectiveHigh) {
            in.problem("dedup_threshold_low must not exceed dedup_threshold");
            in.throwIfInvalid();
        }
        in.values.putIfAbsent("dedup_threshold", DEFAULT_DEDUP_THRESHOLD);
        in.values.putIfAbsent("dedup_threshold_low", DEFAULT_DEDUP_THRESHOLD_LOW);

        boolean dedup = !options.skipDeduplication();

        StepDescriptor export = StepDescriptor.builder(STEP_EXPORT_JIRA,
                        script(SCRIPT_JIRA_EXPORT)
                                .arg("--jql", "project={project} order by resolutiondate DESC")
                                .arg("--resolved-only")
                                .arg("--resolved-after", "{resolved_after}")
                                .optional("--resolved-before", "{resolved_before}")
                                .optional("--limit", "{jira_limit}")
                                .flag("--progress", "progress")
                                .arg("--export", JIRA_EXPORT)
                                .appendVariant("--append")
                                .build())
                .produces(JIRA_EXPORT)
                .supportsAppend()
                .build();

        StepDescriptor llm = StepDescriptor.builder(STEP_LLM,
                        script(SCRIPT_LLM_PROCESS)
                                .arg("--input", JIRA_EXPORT)
                                .arg("--output", JIRA_LLM_OUTPUT)
                                .arg("--not-relevant-out", JIRA_NOT_RELEVANT)
                                .optional("--limit", "{llm_limit}")
                                .optional("--max-calls", "{llm_max_calls}")
                                .appendVariant("--append")
                                .build())
                .requires(JIRA_EXPORT)
                .produces(JIRA_LLM_OUTPUT, JIRA_NOT_RELEVANT)
                .supportsAppend()
                .build();

        StepDescriptor deduplicate = StepDescriptor.builder(STEP_DEDUP,
                        script(SCRIPT_DEDUP)
                                .arg("--input", JIRA_LLM_OUTPUT)
                                .arg("--out", JIRA_DEDUP_OUTPUT)
                                .arg("--groups-out", JIRA_DEDUP_GROUPS)
                                .arg("--review-out", JIRA_DEDUP_REVIEW)
                                .arg("--threshold", "{dedup_threshold}")
                                .arg("--threshold-low", "{dedup_threshold_low}")
                                .build())
                .requires(JIRA_LLM_OUTPUT)
                .produces(JIRA_DEDUP_OUTPUT, JIRA_DEDUP_GROUPS, JIRA_DEDUP_REVIEW)
                .enabled(dedup)
                .build();

        String docxInput = dedup ? JIRA_DEDUP_OUTPUT : JIRA_LLM_OUTPUT;
        StepDescriptor docx = StepDescriptor.builder(STEP_TICKETS_DOCX,
                        script(SCRIPT_TICKETS_TO_DOCX)
                                .arg("--input", docxInput)
                                .arg("--output-dir", stripSlash(JIRA_DOCX_DIR))
                                .arg("--verbose", "true")
                                .build())
                .requires(docxInput)
                .produces(JIRA_DOCX_DIR)
                .build();

        return new FlowPlan(new FlowDefinition(FlowKind.JIRA, List.of(export, llm, deduplicate, docx)),
                new RunParameters(in.values, options));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CommandTemplate.Builder script(String relativePath) {
        return CommandTemplate.program("{python}", "{scripts_dir}/" + relativePath);
    }

    private static String stripSlash(String dir) {
        return dir.endsWith("/") ? dir.substring(0, dir.length() - 1) : dir;
    }

    /**
     * Collects normalized values and problems while reading raw request parameters.
     */
    private static final class ParameterReader {

        private final Map<String, ?>      raw;
        private final Map<String, String> values   = new LinkedHashMap<>();
        private final List<String>        problems = new ArrayList<>();

        ParameterReader(Map<String, ?> raw) {
            this.raw = raw;
        }

        void problem(String message) {
            problems.add(message);
        }

        void throwIfInvalid() {
            if (!problems.isEmpty()) {
                throw new ParameterValidationException(problems);
            }
        }

        private String text(String name) {
            Object value = raw.get(name);
            if (value == null) return null;
            String s = value.toString().trim();
            return s.isEmpty() ? null : s;
        }

        void positiveInt(String name, boolean required) {
            String s = text(name);
            if (s == null) {
                if (required) problem(name + " is required");
                return;
            }
            try {
                long v = Long.parseLong(s);
                if (v <= 0) {
                    problem(name + " must be a positive integer, got " + s);
                } else {
                    values.put(name, Long.toString(v));
                }
            } catch (NumberFormatException e) {
                problem(name + " must be a positive integer, got " + s);
            }
        }

        LocalDate date(String name, boolean required) {
            String s = text(name);
            if (s == null) {
                if (required) problem(name + " is required");
                return null;
            }
            try {
                LocalDate date = s.length() == 8
                        ? LocalDate.parse(s, COMPACT_DATE)
                        : LocalDate.parse(s);
                values.put(name, date.toString());
                return date;
            } catch (DateTimeParseException e) {
                problem(name + " must be a date in YYYY-MM-DD or YYYYMMDD format, got " + s);
                return null;
            }
        }

        Double threshold(String name) {
            String s = text(name);
            if (s == null) return null;
            try {
                double v = Double.parseDouble(s);
                if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
                    problem(name + " must be between 0 and 1, got " + s);
                    return null;
                }
                values.put(name, s);
                return v;
            } catch (NumberFormatException e) {
                problem(name + " must be a number between 0 and 1, got " + s);
                return null;
            }
        }

        void bool(String name) {
            String s = text(name);
            if (s == null) return;
            String lower = s.toLowerCase(Locale.ROOT);
            if (lower.equals("true") || lower.equals("false")) {
                values.put(name, lower);
            } else {
                problem(name + " must be true or false, got " + s);
            }
        }

        void project(String name, List<String> allowed) {
            String s = text(name);
            if (s == null) {
                problem(name + " is required");
                return;
            }
            String upper = s.toUpperCase(Locale.ROOT);
            if (!allowed.contains(upper)) {
                problem(name + " must be one of " + allowed + ", got " + s);
            } else {
                values.put(name, upper);
            }
        }
    }
}
