package com.schemadoc.resolver.resolver;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.model.Candidate;

/**
 * Diagnostic listener that logs each probed candidate and whether it matched.
 */
public class LoggingProbeListener implements ProbeListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingProbeListener.class);

    @Override
    public void onProbe(int attempt, Candidate candidate, Path file, boolean matched) {
        log.info("[{}] {} -> {}", attempt, candidate.getFileName(), matched ? "HIT" : "miss");
    }
}
