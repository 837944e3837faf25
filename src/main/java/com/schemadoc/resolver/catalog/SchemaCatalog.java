package com.schemadoc.resolver.catalog;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Lists and inspects schema files in a directory.
 */
public class SchemaCatalog {
    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    public static final String DEFAULT_GLOB = "*.schema.json";

    private final ObjectMapper mapper;

    public SchemaCatalog() {
        this(new ObjectMapper());
    }

    public SchemaCatalog(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public List<Path> findSchemaFiles(Path schemaDir) throws IOException {
        return findSchemaFiles(schemaDir, DEFAULT_GLOB);
    }

    /**
     * Files under {@code schemaDir} whose relative path matches {@code glob}, sorted.
     * A glob without '/' only matches files directly in the directory; use {@code **}
     * to descend.
     */
    public List<Path> findSchemaFiles(Path schemaDir, String glob) throws IOException {
        Objects.requireNonNull(schemaDir, "schemaDir");
        if (!Files.isDirectory(schemaDir)) {
            log.debug("Schema directory does not exist: {}", schemaDir);
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        // "**/x" in glob syntax needs at least one directory, so also try the bare file name
        PathMatcher nameMatcher = glob.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3))
                : matcher;

        try (Stream<Path> stream = Files.walk(schemaDir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        Path relative = schemaDir.relativize(p);
                        return matcher.matches(relative)
                                || (relative.getNameCount() == 1 && nameMatcher.matches(relative));
                    })
                    .sorted()
                    .toList();
        }
    }

    /**
     * True when the file exists and contains well-formed JSON.
     */
    public boolean isWellFormedJson(Path file) {
        try {
            JsonNode root = mapper.readTree(file.toFile());
            return root != null && !root.isMissingNode();
        } catch (IOException e) {
            log.debug("Not well-formed JSON: {} ({})", file, e.getMessage());
            return false;
        }
    }

    /**
     * Reads title, description, type, property names and required names from a schema file.
     *
     * @throws NoSuchFileException when the file does not exist
     * @throws JsonProcessingException when the file is not valid JSON
     */
    public SchemaInfo describe(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Schema file not found");
        }

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON in schema file {}: {}", file, e.getOriginalMessage());
            throw e;
        }

        SchemaInfo.SchemaInfoBuilder info = SchemaInfo.builder()
                .fileName(file.getFileName().toString())
                .title(root.path("title").asText(""))
                .description(root.path("description").asText(""))
                .type(root.path("type").asText(""));

        JsonNode properties = root.path("properties");
        if (properties.isObject()) {
            Iterator<String> names = properties.fieldNames();
            while (names.hasNext()) {
                info.property(names.next());
            }
        }

        JsonNode required = root.path("required");
        if (required.isArray()) {
            for (JsonNode name : required) {
                info.requiredProperty(name.asText());
            }
        }

        return info.build();
    }
}
