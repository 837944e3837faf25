package com.schemadoc.resolver.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Loads {@link ResolverConfig} from a YAML file.
 *
 * <pre>
 * json_schema_dir: schemas          # relative to the config file
 * debug_logging: false
 * fail_on_missing: false
 * search_policy:
 *   include_package_name: false
 *   path_to_file_separator: "/"
 * </pre>
 */
public class ResolverConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ResolverConfigLoader.class);

    public static final String SCHEMA_DIR = "json_schema_dir";
    public static final String DEBUG_LOGGING = "debug_logging";
    public static final String FAIL_ON_MISSING = "fail_on_missing";
    public static final String SEARCH_POLICY = "search_policy";

    private final ObjectMapper yaml;
    private final SearchPolicyParser policyParser;

    public ResolverConfigLoader() {
        this(new SearchPolicyParser());
    }

    public ResolverConfigLoader(SearchPolicyParser policyParser) {
        this.yaml = new ObjectMapper(new YAMLFactory());
        this.policyParser = Objects.requireNonNull(policyParser, "policyParser");
    }

    public ResolverConfig load(Path configFile) {
        Objects.requireNonNull(configFile, "configFile");
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file does not exist: " + configFile);
        }

        Map<String, Object> raw;
        try (Reader reader = Files.newBufferedReader(configFile)) {
            raw = yaml.readValue(reader, new TypeReference<Map<String, Object>>() { });
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file " + configFile + ": " + e.getMessage(), e);
        }

        Path baseDir = configFile.toAbsolutePath().getParent();
        ResolverConfig config = fromMap(raw, baseDir);
        log.info("Loaded configuration from {}", configFile);
        return config;
    }

    /**
     * Builds a config from already parsed values. Relative schema directories are resolved
     * against {@code baseDir} when it is given.
     */
    public ResolverConfig fromMap(Map<String, ?> raw, Path baseDir) {
        if (raw == null || raw.isEmpty()) {
            return ResolverConfig.defaults();
        }

        ResolverConfig.ResolverConfigBuilder builder = ResolverConfig.builder()
                .searchPolicy(policyParser.parse(raw.get(SEARCH_POLICY)))
                .debugLogging(policyParser.parseBoolean(raw.get(DEBUG_LOGGING), DEBUG_LOGGING, false))
                .failOnMissing(policyParser.parseBoolean(raw.get(FAIL_ON_MISSING), FAIL_ON_MISSING, false));

        Object dir = raw.get(SCHEMA_DIR);
        if (dir != null && !String.valueOf(dir).isBlank()) {
            Path schemaDir = Path.of(String.valueOf(dir));
            if (!schemaDir.isAbsolute() && baseDir != null) {
                schemaDir = baseDir.resolve(schemaDir);
            }
            builder.schemaDir(schemaDir.normalize());
        }

        return builder.build();
    }
}
