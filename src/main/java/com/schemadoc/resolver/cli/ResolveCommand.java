package com.schemadoc.resolver.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.cli.exception.OptionsValidationException;
import com.schemadoc.resolver.cli.model.LookupCliOptions;
import com.schemadoc.resolver.cli.model.ValidatedLookupOptions;
import com.schemadoc.resolver.cli.output.LookupResultsPrinter;
import com.schemadoc.resolver.cli.validation.LookupOptionsValidator;
import com.schemadoc.resolver.resolver.LoggingProbeListener;
import com.schemadoc.resolver.resolver.ProbeFailedException;
import com.schemadoc.resolver.resolver.ProbeListener;
import com.schemadoc.resolver.resolver.ResolutionResult;
import com.schemadoc.resolver.resolver.SchemaResolver;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Resolves the schema file for an object against a schema directory.
 *
 * Exit status: 0 found (or not found without --fail-on-missing), 1 invalid options or
 * probe failure, 2 not found with --fail-on-missing.
 */
@Command(
        name = "resolve",
        mixinStandardHelpOptions = true,
        description = "Finds the first existing schema file for an object."
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    static final int EXIT_NOT_FOUND = 2;

    @Parameters(index = "0", description = "Dotted object identifier, e.g. mypackage.module.MyClass.method")
    private String identifier;

    @Mixin
    private LookupCliOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            ValidatedLookupOptions v = new LookupOptionsValidator().validate(identifier, options, true);
            LookupResultsPrinter printer = new LookupResultsPrinter(spec.commandLine().getOut());
            printer.printBanner(v);

            ProbeListener listener = v.getConfig().isDebugLogging() ? new LoggingProbeListener() : ProbeListener.NONE;
            SchemaResolver resolver = new SchemaResolver(v.getConfig().getSchemaDir(), listener);
            ResolutionResult result = resolver.resolve(v.getObjectPath(), v.getConfig().getSearchPolicy(),
                    v.getLookupOptions());

            printer.printResolution(v, result);

            if (!result.isFound() && v.getConfig().isFailOnMissing()) {
                log.error("No schema file found for {}", v.getObjectPath());
                return EXIT_NOT_FOUND;
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(spec.commandLine().getErr()::println);
            spec.commandLine().getErr().flush();
            return 1;
        } catch (ProbeFailedException e) {
            log.error("Resolution failed: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Resolution failed with exception", e);
            return 1;
        }
    }
}
