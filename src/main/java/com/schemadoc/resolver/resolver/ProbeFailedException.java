package com.schemadoc.resolver.resolver;

import java.io.IOException;
import java.nio.file.Path;

import com.schemadoc.resolver.model.Candidate;

/**
 * A filesystem probe failed for a reason other than "file does not exist".
 *
 * Distinct from a not-found result so callers can fail the build instead of skipping.
 */
public class ProbeFailedException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient Candidate candidate;
    private final transient Path path;

    public ProbeFailedException(Candidate candidate, Path path, String message, Throwable cause) {
        super(message, cause);
        this.candidate = candidate;
        this.path = path;
    }

    public ProbeFailedException(Candidate candidate, Path path, String message) {
        this(candidate, path, message, null);
    }

    /**
     * Candidate being probed; null when the failure happened while reading a resolved file.
     */
    public Candidate getCandidate() {
        return candidate;
    }

    public Path getPath() {
        return path;
    }
}
