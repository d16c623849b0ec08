package com.ticketflow.orchestrator.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Static definition of one pipeline stage.
 *
 * Paths are relative to the run directory, which is also the working
 * directory of the external program. A declared output ending in {@code /}
 * is a directory that must contain at least one non-empty file.
 *
 * @param name                  human-readable step name, unique within a flow
 * @param command               argument template of the external program
 * @param requiredInputs        paths that must validate before the program may start
 * @param declaredOutputs       paths the program must produce on success
 * @param supportsAppend        program understands the append variant of its template
 * @param supportsOverwriteFlag program understands the overwrite variant of its template
 * @param timeout               per-step override of the default timeout, or null
 * @param enabled               false when the request turned this optional step off
 */
public record StepDescriptor(
        String          name,
        CommandTemplate command,
        List<String>    requiredInputs,
        List<String>    declaredOutputs,
        boolean         supportsAppend,
        boolean         supportsOverwriteFlag,
        Duration        timeout,
        boolean         enabled) {

    public StepDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        requiredInputs  = List.copyOf(requiredInputs);
        declaredOutputs = List.copyOf(declaredOutputs);
        if (supportsAppend && !command.hasAppendVariant()) {
            throw new IllegalArgumentException("Step '" + name + "' supports append but its command has no append variant");
        }
        if (supportsOverwriteFlag && !command.hasOverwriteVariant()) {
            throw new IllegalArgumentException("Step '" + name + "' supports overwrite but its command has no overwrite variant");
        }
    }

    public static Builder builder(String name, CommandTemplate command) {
        return new Builder(name, command);
    }

    /** Same descriptor with {@code enabled = false}. */
    public StepDescriptor disabled() {
        return new StepDescriptor(name, command, requiredInputs, declaredOutputs,
                supportsAppend, supportsOverwriteFlag, timeout, false);
    }

    public static final class Builder {
        private final String          name;
        private final CommandTemplate command;
        private List<String> requiredInputs  = List.of();
        private List<String> declaredOutputs = List.of();
        private boolean  supportsAppend;
        private boolean  supportsOverwriteFlag;
        private Duration timeout;
        private boolean  enabled = true;

        private Builder(String name, CommandTemplate command) {
            this.name    = name;
            this.command = command;
        }

        public Builder requires(String... paths)  { this.requiredInputs  = List.of(paths); return this; }
        public Builder produces(String... paths)  { this.declaredOutputs = List.of(paths); return this; }
        public Builder supportsAppend()            { this.supportsAppend = true; return this; }
        public Builder supportsOverwriteFlag()     { this.supportsOverwriteFlag = true; return this; }
        public Builder timeout(Duration timeout)   { this.timeout = timeout; return this; }
        public Builder enabled(boolean enabled)    { this.enabled = enabled; return this; }

        public StepDescriptor build() {
            return new StepDescriptor(name, command, requiredInputs, declaredOutputs,
                    supportsAppend, supportsOverwriteFlag, timeout, enabled);
        }
    }
}
