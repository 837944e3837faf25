package com.schemadoc.resolver;

import com.schemadoc.resolver.cli.SchemaResolverCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Schema File Resolver.
 * Resolves the JSON schema file that documents a function or method, following a
 * configurable file naming policy.
 */
public class SchemaResolverApplication {

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance; tests use it to run commands.
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new SchemaResolverCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
