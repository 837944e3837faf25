package com.schemadoc.resolver.resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectPath;
import com.schemadoc.resolver.model.SearchPolicy;
import com.schemadoc.resolver.pattern.PatternGenerator;

/**
 * Finds the schema file for a documented object inside a schema directory.
 *
 * Candidates are probed in priority order and the first readable regular file wins.
 * A missing directory simply produces a not-found result. Holds no per-call state, so
 * one instance may serve concurrent resolutions.
 */
public class SchemaResolver {
    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    private final Path schemaDir;
    private final PatternGenerator patternGenerator;
    private final ProbeListener probeListener;
    private final SchemaFileProbe probe;

    public SchemaResolver(Path schemaDir) {
        this(schemaDir, ProbeListener.NONE);
    }

    public SchemaResolver(Path schemaDir, ProbeListener probeListener) {
        this(schemaDir, probeListener, SchemaFileProbe.filesystem(), new PatternGenerator());
    }

    public SchemaResolver(Path schemaDir, ProbeListener probeListener, SchemaFileProbe probe,
                          PatternGenerator patternGenerator) {
        this.schemaDir = Objects.requireNonNull(schemaDir, "schemaDir").toAbsolutePath().normalize();
        this.probeListener = probeListener != null ? probeListener : ProbeListener.NONE;
        this.probe = Objects.requireNonNull(probe, "probe");
        this.patternGenerator = Objects.requireNonNull(patternGenerator, "patternGenerator");
    }

    public Path getSchemaDir() {
        return schemaDir;
    }

    public ResolutionResult resolve(ObjectPath path, SearchPolicy policy) throws ProbeFailedException {
        return resolve(path, policy, LookupOptions.defaults());
    }

    public ResolutionResult resolve(ObjectPath path, SearchPolicy policy, LookupOptions options)
            throws ProbeFailedException {
        List<Candidate> candidates = patternGenerator.generate(path, policy, options);
        ResolutionResult result = resolve(candidates);
        if (result.isFound()) {
            log.debug("Resolved {} -> {} ({})", path, result.getCandidate().getFileName(), result.getFileKind());
        } else {
            log.debug("No schema found for {} after {} candidate(s)", path, result.getAttempted().size());
        }
        return result;
    }

    /**
     * Probes an already generated candidate sequence in order.
     */
    public ResolutionResult resolve(List<Candidate> candidates) throws ProbeFailedException {
        Objects.requireNonNull(candidates, "candidates");

        List<Candidate> attempted = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            attempted.add(candidate);
            Path file = schemaDir.resolve(candidate.getFileName()).normalize();

            boolean matched;
            if (!file.startsWith(schemaDir)) {
                log.warn("Candidate '{}' points outside of {}, skipping", candidate.getFileName(), schemaDir);
                matched = false;
            } else {
                matched = probe(candidate, file);
            }

            probeListener.onProbe(attempted.size(), candidate, file, matched);
            if (matched) {
                return ResolutionResult.found(candidate, file, attempted);
            }
        }
        return ResolutionResult.notFound(attempted);
    }

    /**
     * Reads the bytes of a resolved file.
     */
    public byte[] readBytes(ResolutionResult result) throws ProbeFailedException {
        Objects.requireNonNull(result, "result");
        if (!result.isFound()) {
            throw new IllegalStateException("Nothing to read: no schema file was resolved");
        }
        try {
            return Files.readAllBytes(result.getPath());
        } catch (IOException e) {
            throw new ProbeFailedException(result.getCandidate(), result.getPath(),
                    "Failed to read schema file " + result.getPath() + " (" + e.getMessage() + ")", e);
        }
    }

    private boolean probe(Candidate candidate, Path file) throws ProbeFailedException {
        try {
            return probe.exists(file);
        } catch (IOException e) {
            String msg = "Failed to probe candidate '" + candidate.getFileName() + "' at " + file
                    + " (" + e.getMessage() + ")";
            log.error(msg);
            throw new ProbeFailedException(candidate, file, msg, e);
        }
    }
}
