package com.schemadoc.resolver.config;

import java.nio.file.Path;

import com.schemadoc.resolver.model.SearchPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings a documentation build hands to the resolver.
 */
@Value
@Builder(toBuilder = true)
public class ResolverConfig {

    /** Directory holding the schema files; null when not configured. */
    Path schemaDir;

    @NonNull
    @Builder.Default
    SearchPolicy searchPolicy = SearchPolicy.defaults();

    /** Log every probed candidate. */
    boolean debugLogging;

    /** Treat a missing schema as an error rather than skipping the object. */
    boolean failOnMissing;

    public static ResolverConfig defaults() {
        return ResolverConfig.builder().build();
    }
}
