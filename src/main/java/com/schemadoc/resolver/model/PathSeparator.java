package com.schemadoc.resolver.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Separator used when joining parts of a candidate file name.
 */
public enum PathSeparator {
    DOT(".", "."),
    SLASH("/", "/"),
    NONE("", "none");

    private final String joiner;
    private final String token;

    PathSeparator(String joiner, String token) {
        this.joiner = joiner;
        this.token = token;
    }

    /**
     * Text inserted between two joined parts.
     */
    public String getJoiner() {
        return joiner;
    }

    /**
     * Value used for this separator in configuration files.
     */
    public String getToken() {
        return token;
    }

    /**
     * Looks up a separator by its configuration token ("." , "/" or "none", case-insensitive).
     */
    public static Optional<PathSeparator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (PathSeparator separator : values()) {
            if (separator.token.equals(normalized) || separator.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(separator);
            }
        }
        return Optional.empty();
    }
}
