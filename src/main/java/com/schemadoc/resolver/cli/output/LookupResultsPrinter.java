package com.schemadoc.resolver.cli.output;

import java.io.PrintWriter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.cli.model.ValidatedLookupOptions;
import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.SearchPolicy;
import com.schemadoc.resolver.resolver.ResolutionResult;

/**
 * Responsible only for printing CLI output of the lookup commands.
 * Settings go to the log, results to the command's output writer.
 */
public class LookupResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(LookupResultsPrinter.class);

    private final PrintWriter out;

    public LookupResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printBanner(ValidatedLookupOptions v) {
        SearchPolicy policy = v.getConfig().getSearchPolicy();
        log.info("=================================================");
        log.info("Schema File Resolver");
        log.info("=================================================");
        log.info("Object: {}", v.getObjectPath());
        log.info("Schema Directory: {}", v.getConfig().getSchemaDir() != null
                ? v.getConfig().getSchemaDir().toAbsolutePath() : "None");
        log.info("Include Package Name: {}", policy.isIncludePackageName());
        log.info("Include Path To File: {}", policy.isIncludePathToFile());
        log.info("Path To File Separator: {}", policy.getPathToFileSeparator());
        log.info("Path To Class Separator: {}", policy.getPathToClassSeparator());
        if (!policy.getCustomPatterns().isEmpty()) {
            log.info("Custom Patterns: {}", policy.getCustomPatterns());
        }
        if (v.getLookupOptions().hasVariant()) {
            log.info("Variant: {}", v.getLookupOptions().getVariant());
        }
        log.info("File Kinds: {}", v.getLookupOptions().getFileKinds());
        log.info("=================================================");
    }

    public void printCandidates(List<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            out.println(candidate.getFileName());
        }
        out.flush();
    }

    public void printResolution(ValidatedLookupOptions v, ResolutionResult result) {
        if (result.isFound()) {
            out.println("FOUND " + result.getFileKind() + " " + result.getPath());
            log.info("Resolved {} after {} probe(s)", v.getObjectPath(), result.getAttempted().size());
        } else {
            out.println("NOT FOUND " + v.getObjectPath());
            for (String name : result.getAttemptedFileNames()) {
                out.println("  tried " + name);
            }
        }
        out.flush();
    }
}
