package com.schemadoc.resolver.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemadoc.resolver.catalog.SchemaCatalog;
import com.schemadoc.resolver.catalog.SchemaIndexRenderer;
import com.schemadoc.resolver.config.ConfigurationException;
import com.schemadoc.resolver.config.ResolverConfigLoader;
import com.schemadoc.resolver.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Renders a reStructuredText index of the schema files in a directory.
 */
@Command(
        name = "index",
        mixinStandardHelpOptions = true,
        description = "Writes a reStructuredText index of the schema files in a directory."
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Option(names = {"--config", "-c"}, description = "YAML configuration file providing json_schema_dir")
    private Path configFile;

    @Option(names = {"--schema-dir", "-d"}, description = "Directory containing schema files")
    private Path schemaDir;

    @Option(names = {"--glob", "-g"}, defaultValue = SchemaCatalog.DEFAULT_GLOB,
            description = "Glob selecting schema files, relative to the directory (default: ${DEFAULT-VALUE})")
    private String glob;

    @Option(names = {"--output", "-o"}, description = "Write the index to this file instead of standard output")
    private Path output;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            Path dir = schemaDir;
            if (dir == null && configFile != null) {
                dir = new ResolverConfigLoader().load(configFile).getSchemaDir();
            }
            if (dir == null) {
                spec.commandLine().getErr().println("A schema directory is required (--schema-dir / -d, or json_schema_dir in --config).");
                spec.commandLine().getErr().flush();
                return 1;
            }
            if (!Files.isDirectory(dir)) {
                log.warn("Schema directory does not exist: {}", dir);
            }

            String index = new SchemaIndexRenderer().render(dir, glob);

            if (output != null) {
                FileWriteUtil.safeWriteString(output, index);
                log.info("Schema index written to {}", output.toAbsolutePath());
            } else {
                spec.commandLine().getOut().print(index);
                spec.commandLine().getOut().flush();
            }
            return 0;

        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println(e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        } catch (Exception e) {
            log.error("Index generation failed with exception", e);
            return 1;
        }
    }
}
