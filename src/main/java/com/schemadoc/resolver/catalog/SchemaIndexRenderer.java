package com.schemadoc.resolver.catalog;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Renders a reStructuredText index of the schema files in a directory.
 */
public class SchemaIndexRenderer {
    private static final Logger log = LoggerFactory.getLogger(SchemaIndexRenderer.class);

    static final String TEMPLATE_NAME = "schema-index.rst.ftl";

    private final SchemaCatalog catalog;
    private final Configuration freemarkerConfig;

    public SchemaIndexRenderer() {
        this(new SchemaCatalog());
    }

    public SchemaIndexRenderer(SchemaCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(Path schemaDir) throws IOException {
        return render(schemaDir, SchemaCatalog.DEFAULT_GLOB);
    }

    public String render(Path schemaDir, String glob) throws IOException {
        List<Path> files = catalog.findSchemaFiles(schemaDir, glob);
        log.debug("Indexing {} schema file(s) in {}", files.size(), schemaDir);

        List<IndexEntry> entries = new ArrayList<>();
        for (Path file : files) {
            String displayName = schemaDir.relativize(file).toString();
            try {
                entries.add(new IndexEntry(displayName, catalog.describe(file), null));
            } catch (IOException e) {
                log.warn("Could not describe schema file {}: {}", file, e.getMessage());
                entries.add(new IndexEntry(displayName, null, errorText(e)));
            }
        }

        Map<String, Object> model = new HashMap<>();
        model.put("entries", entries);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render schema index: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static String errorText(IOException e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message.lines().findFirst().orElse(message);
    }

    /**
     * Template row; exactly one of {@code info} and {@code error} is set.
     */
    @Value
    public static class IndexEntry {
        String fileName;
        SchemaInfo info;
        String error;
    }
}
