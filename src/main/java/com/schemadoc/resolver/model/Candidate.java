package com.schemadoc.resolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One generated file name, relative to the schema directory.
 */
@Value
@Builder
public class Candidate {

    @NonNull
    String fileName;

    /** File name without variant and kind suffix. */
    @NonNull
    String stem;

    /** Variant inserted before the suffix; null for the plain form. */
    String variant;

    @NonNull
    FileKind kind;

    public static Candidate of(String stem, String variant, FileKind kind) {
        String fileName = variant == null
                ? stem + kind.getSuffix()
                : stem + "." + variant + kind.getSuffix();
        return Candidate.builder()
                .fileName(fileName)
                .stem(stem)
                .variant(variant)
                .kind(kind)
                .build();
    }

    @Override
    public String toString() {
        return fileName;
    }
}
