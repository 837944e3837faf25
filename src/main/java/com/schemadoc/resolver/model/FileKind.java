package com.schemadoc.resolver.model;

/**
 * Kind of file a candidate points at, in default preference order.
 */
public enum FileKind {
    /**
     * Content is a JSON Schema; eligible for synthetic example generation.
     */
    SCHEMA(".schema.json"),

    /**
     * Plain JSON data, rendered as-is.
     */
    PLAIN(".json");

    private final String suffix;

    FileKind(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }
}
