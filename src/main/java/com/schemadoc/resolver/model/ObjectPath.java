package com.schemadoc.resolver.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structural parts of a documented object's dotted identifier.
 *
 * Pure structure only. Joining {@code packageName}, {@code pathSegments},
 * {@code className} and {@code memberName} with dots yields the original identifier.
 */
@Value
@Builder(toBuilder = true)
public class ObjectPath {

    /** Leading namespace segment; null for top-level modules. */
    String packageName;

    /** Intermediate namespace segments between package and class/member. */
    @Singular
    List<String> pathSegments;

    /** Present only for methods. */
    String className;

    @NonNull
    String memberName;

    public boolean hasPackage() {
        return packageName != null;
    }

    public boolean hasClass() {
        return className != null;
    }

    /**
     * Package followed by the path segments, dot-joined. Empty when neither is present.
     */
    public String getQualifiedPackage() {
        List<String> parts = new ArrayList<>();
        if (packageName != null) {
            parts.add(packageName);
        }
        parts.addAll(pathSegments);
        return String.join(".", parts);
    }

    /**
     * Reconstructs the dotted identifier this path was parsed from.
     */
    public String toIdentifier() {
        List<String> parts = new ArrayList<>();
        if (packageName != null) {
            parts.add(packageName);
        }
        parts.addAll(pathSegments);
        if (className != null) {
            parts.add(className);
        }
        parts.add(memberName);
        return String.join(".", parts);
    }

    @Override
    public String toString() {
        return toIdentifier();
    }
}
