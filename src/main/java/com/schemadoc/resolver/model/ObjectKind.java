package com.schemadoc.resolver.model;

/**
 * Structural shape of a documented object, supplied by the caller.
 */
public enum ObjectKind {
    /** Module-level function: no class token. */
    FUNCTION,
    /** Method: the token before the member is the class. */
    METHOD
}
