package com.schemadoc.resolver.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Per-lookup parameters that are not part of the naming policy.
 */
@Value
@Builder(toBuilder = true)
public class LookupOptions {

    private static final List<FileKind> DEFAULT_KINDS = List.of(FileKind.SCHEMA, FileKind.PLAIN);

    /**
     * Opaque discriminator inserted before the file suffix, e.g. {@code options}
     * in {@code MyClass.method.options.schema.json}. Null when not requested.
     */
    String variant;

    /**
     * File kinds to try for every stem, in order.
     */
    @Builder.Default
    List<FileKind> fileKinds = DEFAULT_KINDS;

    public static LookupOptions defaults() {
        return LookupOptions.builder().build();
    }

    public static LookupOptions forVariant(String variant) {
        return LookupOptions.builder().variant(variant).build();
    }

    public boolean hasVariant() {
        return variant != null && !variant.isEmpty();
    }
}
