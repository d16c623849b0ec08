package com.ticketflow.orchestrator.environment;

import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.model.FlowKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Reports which credentials the external programs expect and whether they
 * are set. Values come from {@code ticketflow.engine.environment} first, then
 * from the engine's own environment, which is what the programs inherit.
 *
 * {@code GET /env-status} reports all services. A run is admitted with an
 * incomplete environment but fails before its first step, see
 * {@link #problemsFor(FlowKind)}.
 */
@Component
public class EnvironmentCheck {

    public static final String JITBIT = "jitbit";
    public static final String JIRA   = "jira";
    public static final String LLM    = "llm";

    private static final Pattern URL = Pattern.compile(
            "^https?://"
                    + "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+[A-Z]{2,6}\\.?|localhost|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})"
                    + "(?::\\d+)?(?:/?|[/?]\\S+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final UnaryOperator<String> lookup;

    @Autowired
    public EnvironmentCheck(EngineProperties properties) {
        this(name -> {
            String configured = properties.getEnvironment().get(name);
            return configured != null ? configured : System.getenv(name);
        });
    }

    public EnvironmentCheck(UnaryOperator<String> lookup) {
        this.lookup = lookup;
    }

    /** Status per service: jitbit, jira, llm. */
    public List<ServiceStatus> checkAll() {
        return List.of(
                ServiceStatus.of(JITBIT, jitbit()),
                ServiceStatus.of(JIRA, jira()),
                ServiceStatus.of(LLM, llm()));
    }

    /** Services a flow's programs need. */
    public static List<String> servicesFor(FlowKind flow) {
        return switch (flow) {
            case JITBIT -> List.of(JITBIT, LLM);
            case JIRA   -> List.of(JIRA, LLM);
        };
    }

    /**
     * Problems that keep {@code flow} from running, one per missing or
     * malformed variable. Empty when the flow's environment is complete.
     */
    public List<String> problemsFor(FlowKind flow) {
        List<String> needed = servicesFor(flow);
        return checkAll().stream()
                .filter(s -> needed.contains(s.service()) && !s.allOk())
                .flatMap(s -> s.details().stream())
                .filter(v -> !v.ok())
                .map(v -> v.key() + ": " + v.message())
                .toList();
    }

    // ------------------------------------------------------------------
    // Per service
    // ------------------------------------------------------------------

    private List<VariableCheck> jitbit() {
        return List.of(
                check("JITBIT_API_TOKEN", true, null, "(Jitbit API token)"),
                check("JITBIT_BASE_URL", true, URL, "(Jitbit base URL)"));
    }

    private List<VariableCheck> jira() {
        return List.of(
                check("JIRA_EMAIL", true, EMAIL, "(Jira email address)"),
                check("JIRA_API_TOKEN", true, null, "(Jira API token)"));
    }

    private List<VariableCheck> llm() {
        List<VariableCheck> results = new ArrayList<>();
        boolean secret = isSet("SCW_SECRET_KEY");
        boolean apiKey = isSet("SCW_API_KEY");
        if (secret) results.add(new VariableCheck("SCW_SECRET_KEY", true, true, "(Scaleway secret key present)"));
        if (apiKey) results.add(new VariableCheck("SCW_API_KEY", true, true, "(Scaleway API key present)"));
        if (!secret && !apiKey) {
            results.add(new VariableCheck("SCW_SECRET_KEY or SCW_API_KEY", false, false,
                    "(At least one Scaleway key required)"));
        }
        results.add(check("SCW_OPENAI_BASE_URL", true, URL, "(Scaleway OpenAI base URL)"));
        results.add(check("LLM_MODEL", false, null, "(LLM model name, optional)"));
        return results;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean isSet(String key) {
        String value = lookup.apply(key);
        return value != null && !value.isBlank();
    }

    private VariableCheck check(String key, boolean required, Pattern format, String description) {
        if (!isSet(key)) {
            return required
                    ? new VariableCheck(key, false, false, "Missing required variable " + description)
                    : new VariableCheck(key, false, true, "Optional variable not set " + description);
        }
        if (format != null && !format.matcher(lookup.apply(key).trim()).matches()) {
            return new VariableCheck(key, true, false, "Present but invalid format " + description);
        }
        return new VariableCheck(key, true, true, "Present " + description);
    }
}
