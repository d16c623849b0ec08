package com.ticketflow.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTemplateTest {

    final CommandTemplate template = CommandTemplate.program("{python}", "{scripts_dir}/process.py")
            .arg("--input", "in.json")
            .optional("--limit", "{llm_limit}")
            .flag("--newest-first", "newest_first")
            .arg("--save-interval", "{llm_save_interval}")
            .appendVariant("--append")
            .overwriteVariant("--overwrite")
            .build();

    @Test
    void resolve_optionalGroupsOnlyWhenBound() {
        var cmd = template.resolve(Map.of(
                "python", "python3", "scripts_dir", "/opt/s", "llm_save_interval", "50"), false, false);

        assertThat(cmd).containsExactly("python3", "/opt/s/process.py", "--input", "in.json",
                "--save-interval", "50");
    }

    @Test
    void resolve_allGroupsAndVariants() {
        var cmd = template.resolve(Map.of(
                "python", "py", "scripts_dir", "s", "llm_limit", "10",
                "newest_first", "true", "llm_save_interval", "5"), true, true);

        assertThat(cmd).containsExactly("py", "s/process.py", "--input", "in.json",
                "--limit", "10", "--newest-first", "--save-interval", "5", "--append", "--overwrite");
    }

    @Test
    void resolve_blankOptionalValue_omitsGroup() {
        var cmd = template.resolve(Map.of(
                "python", "py", "scripts_dir", "s", "llm_limit", " ", "llm_save_interval", "5"), false, false);

        assertThat(cmd).doesNotContain("--limit");
    }

    @Test
    void resolve_placeholderInsideToken_isSubstituted() {
        CommandTemplate jql = CommandTemplate.program("x")
                .arg("--jql", "project={project} order by resolutiondate DESC")
                .build();

        assertThat(jql.resolve(Map.of("project", "SUP"), false, false))
                .containsExactly("x", "--jql", "project=SUP order by resolutiondate DESC");
    }

    @Test
    void resolve_unboundRequiredPlaceholder_throws() {
        assertThatThrownBy(() -> template.resolve(Map.of("python", "py"), false, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("{scripts_dir}");
    }

    @Test
    void stepDescriptor_appendSupportWithoutVariant_isRejected() {
        CommandTemplate plain = CommandTemplate.program("x").build();

        assertThatThrownBy(() -> StepDescriptor.builder("export", plain).supportsAppend().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no append variant");
        assertThatThrownBy(() -> StepDescriptor.builder("export", plain).supportsOverwriteFlag().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no overwrite variant");
        assertThat(StepDescriptor.builder("llm", template).supportsAppend().supportsOverwriteFlag().build()
                .supportsAppend()).isTrue();
    }
}
