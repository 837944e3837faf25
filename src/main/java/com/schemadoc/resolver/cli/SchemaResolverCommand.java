package com.schemadoc.resolver.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; dispatches to the subcommands.
 */
@Command(
        name = "schema-resolver",
        mixinStandardHelpOptions = true,
        version = "schema-file-resolver 1.0.0",
        description = "Locates JSON schema files for documented functions and methods.",
        subcommands = {
                CandidatesCommand.class,
                ResolveCommand.class,
                IndexCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class SchemaResolverCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // No subcommand given: show usage
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
