package com.ticketflow.orchestrator.artifact;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Decides whether a file on disk is usable as a completed step's output.
 *
 * Rules, by declared path:
 * <ul>
 *   <li>{@code dir/}: an existing directory containing at least one non-empty regular file;</li>
 *   <li>{@code *.json}: a non-empty file holding exactly one JSON object or array;</li>
 *   <li>anything else: a non-empty regular file.</li>
 * </ul>
 * JSON is checked with a streaming parser so multi-hundred-megabyte exports
 * are never loaded into memory.
 */
@Component
public class ArtifactValidator {

    private final ObjectMapper objectMapper;

    public ArtifactValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Validate one declared path, resolved against the run directory. */
    public ArtifactCheck check(Path runDirectory, String declaredPath) {
        Path path = runDirectory.resolve(stripSlash(declaredPath)).normalize();
        if (!path.startsWith(runDirectory.normalize())) {
            return ArtifactCheck.rejected(declaredPath, "path escapes the run directory");
        }
        if (isDirectoryDeclaration(declaredPath)) {
            return checkDirectory(declaredPath, path);
        }
        if (!Files.isRegularFile(path)) {
            return ArtifactCheck.rejected(declaredPath, "missing");
        }
        try {
            if (Files.size(path) == 0) {
                return ArtifactCheck.rejected(declaredPath, "empty file");
            }
        } catch (IOException e) {
            return ArtifactCheck.rejected(declaredPath, "unreadable: " + e.getMessage());
        }
        if (declaredPath.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return checkJson(declaredPath, path);
        }
        return ArtifactCheck.ok(declaredPath);
    }

    /** Validate every path; the result keeps the declaration order. */
    public List<ArtifactCheck> checkAll(Path runDirectory, List<String> declaredPaths) {
        return declaredPaths.stream().map(p -> check(runDirectory, p)).toList();
    }

    /** True when every declared path validates. An empty list is trivially valid. */
    public boolean allValid(Path runDirectory, List<String> declaredPaths) {
        return checkAll(runDirectory, declaredPaths).stream().allMatch(ArtifactCheck::valid);
    }

    public static boolean isDirectoryDeclaration(String declaredPath) {
        return declaredPath.endsWith("/");
    }

    static String stripSlash(String declaredPath) {
        return isDirectoryDeclaration(declaredPath)
                ? declaredPath.substring(0, declaredPath.length() - 1)
                : declaredPath;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ArtifactCheck checkDirectory(String declaredPath, Path dir) {
        if (!Files.isDirectory(dir)) {
            return ArtifactCheck.rejected(declaredPath, "missing directory");
        }
        try (Stream<Path> files = Files.walk(dir)) {
            boolean hasContent = files.filter(Files::isRegularFile).anyMatch(ArtifactValidator::nonEmpty);
            return hasContent
                    ? ArtifactCheck.ok(declaredPath)
                    : ArtifactCheck.rejected(declaredPath, "directory has no non-empty files");
        } catch (IOException e) {
            return ArtifactCheck.rejected(declaredPath, "unreadable directory: " + e.getMessage());
        }
    }

    private ArtifactCheck checkJson(String declaredPath, Path file) {
        try (JsonParser parser = objectMapper.getFactory().createParser(file.toFile())) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_ARRAY && first != JsonToken.START_OBJECT) {
                return ArtifactCheck.rejected(declaredPath, "JSON root is not an object or array");
            }
            parser.skipChildren();
            if (parser.nextToken() != null) {
                return ArtifactCheck.rejected(declaredPath, "trailing content after JSON document");
            }
            return ArtifactCheck.ok(declaredPath);
        } catch (JsonProcessingException e) {
            return ArtifactCheck.rejected(declaredPath,
                    "malformed JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ArtifactCheck.rejected(declaredPath, "unreadable: " + e.getMessage());
        }
    }

    private static boolean nonEmpty(Path file) {
        try {
            return Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }
}
