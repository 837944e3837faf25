package com.schemadoc.resolver.resolver;

import java.nio.file.Path;
import java.util.List;

import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.FileKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a resolution: the first matching file, or not-found with every candidate tried.
 */
@Value
@Builder
public class ResolutionResult {

    boolean found;

    /** Matching candidate; null when not found. */
    Candidate candidate;

    /** Absolute path of the matching file; null when not found. */
    Path path;

    /** Candidates probed, in order. Ends with the match when found. */
    @NonNull
    List<Candidate> attempted;

    public static ResolutionResult found(Candidate candidate, Path path, List<Candidate> attempted) {
        return ResolutionResult.builder()
                .found(true)
                .candidate(candidate)
                .path(path)
                .attempted(List.copyOf(attempted))
                .build();
    }

    public static ResolutionResult notFound(List<Candidate> attempted) {
        return ResolutionResult.builder()
                .found(false)
                .attempted(List.copyOf(attempted))
                .build();
    }

    /**
     * Kind of the matched file; null when not found.
     */
    public FileKind getFileKind() {
        return candidate != null ? candidate.getKind() : null;
    }

    /**
     * True when the match holds a JSON Schema rather than plain data.
     */
    public boolean isSchemaTyped() {
        return getFileKind() == FileKind.SCHEMA;
    }

    public List<String> getAttemptedFileNames() {
        return attempted.stream().map(Candidate::getFileName).toList();
    }
}
