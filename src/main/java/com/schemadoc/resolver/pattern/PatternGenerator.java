package com.schemadoc.resolver.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.FileKind;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectPath;
import com.schemadoc.resolver.model.PathSeparator;
import com.schemadoc.resolver.model.SearchPolicy;

/**
 * Produces the ordered candidate file names for a documented object.
 *
 * Stem order, highest priority first:
 * <ol>
 *   <li>custom patterns, as configured</li>
 *   <li>base name: {@code Class<sep>member} or {@code member}</li>
 *   <li>path windows, nearest segment first (when path context is enabled)</li>
 *   <li>fully-qualified name, when the package name is included</li>
 *   <li>member alone, for methods</li>
 *   <li>fully-qualified name, when the package name is not included</li>
 * </ol>
 * Every stem expands to its variant forms (if a variant was requested) followed by its
 * plain forms, one per file kind. The result is de-duplicated keeping the first occurrence.
 *
 * Stateless and thread-safe.
 */
public class PatternGenerator {
    private static final Logger log = LoggerFactory.getLogger(PatternGenerator.class);

    private final CustomPatternRenderer customPatternRenderer;

    public PatternGenerator() {
        this(new CustomPatternRenderer());
    }

    public PatternGenerator(CustomPatternRenderer customPatternRenderer) {
        this.customPatternRenderer = Objects.requireNonNull(customPatternRenderer, "customPatternRenderer");
    }

    public List<Candidate> generate(ObjectPath path, SearchPolicy policy) {
        return generate(path, policy, LookupOptions.defaults());
    }

    public List<Candidate> generate(ObjectPath path, SearchPolicy policy, LookupOptions options) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(options, "options");

        List<FileKind> kinds = options.getFileKinds();
        if (kinds == null || kinds.isEmpty()) {
            throw new IllegalArgumentException("At least one file kind must be requested");
        }
        if (kinds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("File kinds must not contain null: " + kinds);
        }

        List<String> stems = generateStems(path, policy);

        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (String stem : stems) {
            if (options.hasVariant()) {
                for (FileKind kind : kinds) {
                    unique.putIfAbsent(stem + "." + options.getVariant() + kind.getSuffix(),
                            Candidate.of(stem, options.getVariant(), kind));
                }
            }
            for (FileKind kind : kinds) {
                unique.putIfAbsent(stem + kind.getSuffix(), Candidate.of(stem, null, kind));
            }
        }

        List<Candidate> candidates = List.copyOf(unique.values());
        log.debug("Generated {} candidate(s) from {} stem(s) for {}", candidates.size(), stems.size(), path);
        return candidates;
    }

    /**
     * Convenience form returning only the file names.
     */
    public List<String> generateFileNames(ObjectPath path, SearchPolicy policy, LookupOptions options) {
        return generate(path, policy, options).stream()
                .map(Candidate::getFileName)
                .toList();
    }

    /**
     * Ordered stems before suffix expansion. May contain duplicates.
     */
    List<String> generateStems(ObjectPath path, SearchPolicy policy) {
        List<String> stems = new ArrayList<>();

        // 1. Custom patterns
        for (String template : policy.getCustomPatterns()) {
            String stem = customPatternRenderer.renderStem(template, path);
            if (stem.isBlank()) {
                log.debug("Custom pattern '{}' rendered an empty name for {}, skipping", template, path);
                continue;
            }
            stems.add(stem);
        }

        // 2. Base name
        String baseName = baseName(path, policy.getPathToClassSeparator());
        stems.add(baseName);

        // 3. Path windows, nearest context first
        if (policy.isIncludePathToFile()) {
            PathSeparator separator = policy.getPathToFileSeparator();
            List<String> segments = path.getPathSegments();
            for (int window = 1; window <= segments.size(); window++) {
                List<String> parts = new ArrayList<>(segments.subList(segments.size() - window, segments.size()));
                parts.add(baseName);
                stems.add(String.join(separator.getJoiner(), parts));
            }
            if (policy.isIncludePackageName() && path.hasPackage()) {
                List<String> parts = new ArrayList<>();
                parts.add(path.getPackageName());
                parts.addAll(segments);
                parts.add(baseName);
                stems.add(String.join(separator.getJoiner(), parts));
            }
        }

        String fullyQualified = path.toIdentifier();

        // 4. Promoted fully-qualified fallback
        if (policy.isIncludePackageName()) {
            stems.add(fullyQualified);
        }

        // 5. Member only, shared across same-named methods
        if (path.hasClass()) {
            stems.add(path.getMemberName());
        }

        // 6. Fully-qualified fallback, always present
        if (!policy.isIncludePackageName()) {
            stems.add(fullyQualified);
        }

        return stems;
    }

    private static String baseName(ObjectPath path, PathSeparator classSeparator) {
        if (!path.hasClass()) {
            return path.getMemberName();
        }
        return path.getClassName() + classSeparator.getJoiner() + path.getMemberName();
    }
}
