package com.schemadoc.resolver.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Naming policy that drives candidate generation.
 *
 * Immutable; safe to share between concurrent resolutions.
 */
@Value
@Builder(toBuilder = true)
public class SearchPolicy {

    private static final SearchPolicy DEFAULTS = SearchPolicy.builder().build();

    /** Promote the fully-qualified candidate ahead of the member-only fallback. */
    @Builder.Default
    boolean includePackageName = false;

    /** Emit candidates prefixed with enclosing path segments. */
    @Builder.Default
    boolean includePathToFile = true;

    /** Separator between path segments and the class/member part. */
    @NonNull
    @Builder.Default
    PathSeparator pathToFileSeparator = PathSeparator.DOT;

    /** Separator between class and member. */
    @NonNull
    @Builder.Default
    PathSeparator pathToClassSeparator = PathSeparator.DOT;

    /**
     * Templates tried before any standard candidate. Placeholders:
     * {@code {object_name}}, {@code {class_name}}, {@code {method_name}}, {@code {package_name}}.
     */
    @Singular
    List<String> customPatterns;

    public static SearchPolicy defaults() {
        return DEFAULTS;
    }
}
