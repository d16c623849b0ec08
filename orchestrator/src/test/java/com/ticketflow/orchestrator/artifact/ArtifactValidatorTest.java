package com.ticketflow.orchestrator.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactValidatorTest {

    @TempDir Path runDir;

    final ArtifactValidator validator = new ArtifactValidator(new ObjectMapper());

    // ------------------------------------------------------------------
    // JSON files
    // ------------------------------------------------------------------

    @Test
    void jsonArray_isValid() throws IOException {
        Files.writeString(runDir.resolve("t.json"), "[{\"id\": 1}, {\"id\": 2}]");
        assertThat(validator.check(runDir, "t.json").valid()).isTrue();
    }

    @Test
    void jsonObject_isValid() throws IOException {
        Files.writeString(runDir.resolve("t.json"), "{\"tickets\": []}\n");
        assertThat(validator.check(runDir, "t.json").valid()).isTrue();
    }

    @Test
    void truncatedJson_isRejected() throws IOException {
        Files.writeString(runDir.resolve("t.json"), "[{\"id\": 1}, {\"id\": ");

        ArtifactCheck check = validator.check(runDir, "t.json");

        assertThat(check.valid()).isFalse();
        assertThat(check.reason()).startsWith("malformed JSON");
    }

    @Test
    void jsonScalarRoot_isRejected() throws IOException {
        Files.writeString(runDir.resolve("t.json"), "42");
        assertThat(validator.check(runDir, "t.json").reason()).contains("not an object or array");
    }

    @Test
    void trailingContent_isRejected() throws IOException {
        Files.writeString(runDir.resolve("t.json"), "[] []");
        assertThat(validator.check(runDir, "t.json").reason()).contains("trailing content");
    }

    // ------------------------------------------------------------------
    // Plain files and directories
    // ------------------------------------------------------------------

    @Test
    void missingOrEmptyFile_isRejected() throws IOException {
        Files.createFile(runDir.resolve("empty.csv"));

        assertThat(validator.check(runDir, "absent.csv").reason()).isEqualTo("missing");
        assertThat(validator.check(runDir, "empty.csv").reason()).isEqualTo("empty file");
    }

    @Test
    void nonJsonFile_onlyNeedsContent() throws IOException {
        Files.writeString(runDir.resolve("review.csv"), "a,b\n");
        assertThat(validator.check(runDir, "review.csv").valid()).isTrue();
    }

    @Test
    void directory_needsOneNonEmptyFile() throws IOException {
        Path docs = Files.createDirectories(runDir.resolve("documents/jira"));
        assertThat(validator.check(runDir, "documents/jira/").valid()).isFalse();

        Files.createFile(docs.resolve("empty.docx"));
        assertThat(validator.check(runDir, "documents/jira/").valid()).isFalse();

        Files.writeString(docs.resolve("SUP-1.docx"), "PK");
        assertThat(validator.check(runDir, "documents/jira/").valid()).isTrue();
    }

    @Test
    void pathOutsideRunDirectory_isRejected() {
        assertThat(validator.check(runDir, "../elsewhere.json").reason())
                .isEqualTo("path escapes the run directory");
    }

    @Test
    void allValid_emptyListIsTrue_anyInvalidIsFalse() throws IOException {
        Files.writeString(runDir.resolve("a.json"), "[]");

        assertThat(validator.allValid(runDir, List.of())).isTrue();
        assertThat(validator.allValid(runDir, List.of("a.json"))).isTrue();
        assertThat(validator.allValid(runDir, List.of("a.json", "b.json"))).isFalse();
    }
}
