package com.ticketflow.orchestrator.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Argument template for one external program.
 *
 * The template is an ordered list of argument groups. Tokens may contain
 * {@code {name}} placeholders which are replaced by the run's parameter values.
 * <ul>
 *   <li>required groups must have every placeholder bound;</li>
 *   <li>optional groups are emitted only when every placeholder is bound;</li>
 *   <li>flag groups are emitted only when the named parameter is {@code "true"}.</li>
 * </ul>
 * The append and overwrite variants are appended at the end when the skip
 * policy selects the corresponding mode.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z][a-z0-9_]*)}");

    enum Kind { REQUIRED, OPTIONAL, FLAG }

    record Group(Kind kind, List<String> tokens, String parameter) {}

    private final List<Group>  groups;
    private final List<String> appendVariant;
    private final List<String> overwriteVariant;

    private CommandTemplate(List<Group> groups, List<String> appendVariant, List<String> overwriteVariant) {
        this.groups           = List.copyOf(groups);
        this.appendVariant    = List.copyOf(appendVariant);
        this.overwriteVariant = List.copyOf(overwriteVariant);
    }

    /** Start a template whose first tokens are the program (and e.g. the script path). */
    public static Builder program(String... tokens) {
        return new Builder().arg(tokens);
    }

    public boolean hasAppendVariant()    { return !appendVariant.isEmpty(); }
    public boolean hasOverwriteVariant() { return !overwriteVariant.isEmpty(); }

    /**
     * Resolve the template into a concrete command line.
     *
     * @throws IllegalArgumentException if a required group references an unbound placeholder
     */
    public List<String> resolve(Map<String, String> bindings, boolean appendMode, boolean overwriteMode) {
        List<String> command = new ArrayList<>();
        for (Group group : groups) {
            switch (group.kind()) {
                case REQUIRED -> command.addAll(substitute(group.tokens(), bindings));
                case OPTIONAL -> {
                    if (allBound(group.tokens(), bindings)) {
                        command.addAll(substitute(group.tokens(), bindings));
                    }
                }
                case FLAG -> {
                    if ("true".equalsIgnoreCase(bindings.get(group.parameter()))) {
                        command.addAll(group.tokens());
                    }
                }
            }
        }
        if (appendMode) {
            command.addAll(substitute(appendVariant, bindings));
        }
        if (overwriteMode) {
            command.addAll(substitute(overwriteVariant, bindings));
        }
        return command;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Group group : groups) {
            String joined = String.join(" ", group.tokens());
            parts.add(switch (group.kind()) {
                case REQUIRED -> joined;
                case OPTIONAL -> "[" + joined + "]";
                case FLAG     -> "[" + joined + " if " + group.parameter() + "]";
            });
        }
        return String.join(" ", parts);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean allBound(List<String> tokens, Map<String, String> bindings) {
        for (String token : tokens) {
            Matcher m = PLACEHOLDER.matcher(token);
            while (m.find()) {
                String value = bindings.get(m.group(1));
                if (value == null || value.isBlank()) return false;
            }
        }
        return true;
    }

    private static List<String> substitute(List<String> tokens, Map<String, String> bindings) {
        List<String> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Matcher m = PLACEHOLDER.matcher(token);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String value = bindings.get(m.group(1));
                if (value == null) {
                    throw new IllegalArgumentException("No value bound for placeholder {" + m.group(1) + "}");
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            m.appendTail(sb);
            out.add(sb.toString());
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final List<Group>  groups           = new ArrayList<>();
        private final List<String> appendVariant    = new ArrayList<>();
        private final List<String> overwriteVariant = new ArrayList<>();

        private Builder() {}

        public Builder arg(String... tokens) {
            groups.add(new Group(Kind.REQUIRED, Arrays.asList(tokens), null));
            return this;
        }

        public Builder optional(String... tokens) {
            groups.add(new Group(Kind.OPTIONAL, Arrays.asList(tokens), null));
            return this;
        }

        public Builder flag(String flag, String parameter) {
            groups.add(new Group(Kind.FLAG, List.of(flag), parameter));
            return this;
        }

        public Builder appendVariant(String... tokens) {
            appendVariant.addAll(Arrays.asList(tokens));
            return this;
        }

        public Builder overwriteVariant(String... tokens) {
            overwriteVariant.addAll(Arrays.asList(tokens));
            return this;
        }

        public CommandTemplate build() {
            return new CommandTemplate(groups, appendVariant, overwriteVariant);
        }
    }
}
