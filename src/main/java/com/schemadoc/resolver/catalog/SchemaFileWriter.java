package com.schemadoc.resolver.catalog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.FileKind;
import com.schemadoc.resolver.util.FileWriteUtil;

/**
 * Writes schema files named the way the resolver looks them up.
 */
public class SchemaFileWriter {
    private static final Logger log = LoggerFactory.getLogger(SchemaFileWriter.class);

    private final ObjectMapper mapper;

    public SchemaFileWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SchemaFileWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** {@code <function>.schema.json} */
    public Path writeFunctionSchema(Path schemaDir, String functionName, Object schema) throws IOException {
        return write(schemaDir, functionName, null, FileKind.SCHEMA, schema);
    }

    /** {@code <Class>.<method>.schema.json} */
    public Path writeMethodSchema(Path schemaDir, String className, String methodName, Object schema)
            throws IOException {
        return write(schemaDir, className + "." + methodName, null, FileKind.SCHEMA, schema);
    }

    /** {@code <stem>.<variant>.schema.json} */
    public Path writeVariantSchema(Path schemaDir, String stem, String variant, Object schema) throws IOException {
        return write(schemaDir, stem, variant, FileKind.SCHEMA, schema);
    }

    /**
     * Writes {@code content} as JSON under the file name derived from stem, variant and kind.
     * The stem may contain '/' to place the file in a subdirectory.
     */
    public Path write(Path schemaDir, String stem, String variant, FileKind kind, Object content)
            throws IOException {
        Objects.requireNonNull(schemaDir, "schemaDir");
        Objects.requireNonNull(content, "content");

        Candidate name = Candidate.of(stem, variant, kind);
        Path target = schemaDir.resolve(name.getFileName());
        FileWriteUtil.safeWriteString(target, mapper.writeValueAsString(content));

        log.debug("Wrote {} file {}", kind, target);
        return target;
    }
}
