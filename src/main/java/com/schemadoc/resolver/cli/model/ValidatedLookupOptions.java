package com.schemadoc.resolver.cli.model;

import com.schemadoc.resolver.config.ResolverConfig;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectPath;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the lookup commands. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedLookupOptions {
    ObjectPath objectPath;
    ResolverConfig config;
    LookupOptions lookupOptions;
}
