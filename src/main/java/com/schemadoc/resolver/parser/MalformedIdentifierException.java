package com.schemadoc.resolver.parser;

/**
 * Raised when an object identifier cannot be turned into an ObjectPath.
 */
public class MalformedIdentifierException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public MalformedIdentifierException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
