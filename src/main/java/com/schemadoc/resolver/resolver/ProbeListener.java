package com.schemadoc.resolver.resolver;

import java.nio.file.Path;

import com.schemadoc.resolver.model.Candidate;

/**
 * Receives every probe made during a resolution, in order.
 */
@FunctionalInterface
public interface ProbeListener {

    ProbeListener NONE = (attempt, candidate, file, matched) -> { };

    /**
     * @param attempt 1-based position of the probe within the resolution
     */
    void onProbe(int attempt, Candidate candidate, Path file, boolean matched);
}
