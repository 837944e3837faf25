package com.schemadoc.resolver.catalog;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Summary of a schema file's top-level metadata.
 */
@Value
@Builder
public class SchemaInfo {

    @NonNull
    String fileName;

    @Builder.Default
    String title = "";

    @Builder.Default
    String description = "";

    @Builder.Default
    String type = "";

    /** Property names in document order. */
    @Singular
    List<String> properties;

    @Singular("requiredProperty")
    List<String> required;
}
