package com.schemadoc.resolver.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.cli.exception.OptionsValidationException;
import com.schemadoc.resolver.cli.model.LookupCliOptions;
import com.schemadoc.resolver.cli.model.ValidatedLookupOptions;
import com.schemadoc.resolver.cli.output.LookupResultsPrinter;
import com.schemadoc.resolver.cli.validation.LookupOptionsValidator;
import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.pattern.PatternGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the ordered candidate file names for an object without touching the filesystem.
 */
@Command(
        name = "candidates",
        mixinStandardHelpOptions = true,
        description = "Lists candidate schema file names for an object, highest priority first."
)
public class CandidatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CandidatesCommand.class);

    @Parameters(index = "0", description = "Dotted object identifier, e.g. mypackage.module.MyClass.method")
    private String identifier;

    @Mixin
    private LookupCliOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            ValidatedLookupOptions v = new LookupOptionsValidator().validate(identifier, options, false);

            List<Candidate> candidates = new PatternGenerator()
                    .generate(v.getObjectPath(), v.getConfig().getSearchPolicy(), v.getLookupOptions());

            new LookupResultsPrinter(spec.commandLine().getOut()).printCandidates(candidates);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(spec.commandLine().getErr()::println);
            spec.commandLine().getErr().flush();
            return 1;
        } catch (Exception e) {
            log.error("Candidate generation failed with exception", e);
            return 1;
        }
    }
}
