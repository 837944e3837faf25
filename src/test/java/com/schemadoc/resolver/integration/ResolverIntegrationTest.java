package com.schemadoc.resolver.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemadoc.resolver.catalog.SchemaCatalog;
import com.schemadoc.resolver.catalog.SchemaFileWriter;
import com.schemadoc.resolver.catalog.SchemaIndexRenderer;
import com.schemadoc.resolver.config.ResolverConfig;
import com.schemadoc.resolver.config.ResolverConfigLoader;
import com.schemadoc.resolver.model.FileKind;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectPath;
import com.schemadoc.resolver.parser.ObjectPathParser;
import com.schemadoc.resolver.resolver.ResolutionResult;
import com.schemadoc.resolver.resolver.SchemaResolver;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests: configuration file, schema directory on disk, resolution and index.
 */
class ResolverIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testResolveWithConfiguredPolicy() throws IOException {
        Path schemas = Files.createDirectories(tempDir.resolve("schemas"));
        Path config = tempDir.resolve("resolver.yaml");
        Files.writeString(config, """
                json_schema_dir: schemas
                search_policy:
                  include_package_name: true
                  path_to_file_separator: "/"
                """);

        SchemaFileWriter writer = new SchemaFileWriter();
        writer.write(schemas, "mypackage/module/MyClass.method", null, FileKind.SCHEMA,
                Map.of("title", "Deep", "type", "object"));
        writer.writeFunctionSchema(schemas, "method", Map.of("title", "Shallow"));

        ResolverConfig resolverConfig = new ResolverConfigLoader().load(config);
        ObjectPath path = new ObjectPathParser().parseMethod("mypackage.module.MyClass.method");

        ResolutionResult result = new SchemaResolver(resolverConfig.getSchemaDir())
                .resolve(path, resolverConfig.getSearchPolicy());

        assertThat(result.isFound()).isTrue();
        assertThat(result.getCandidate().getFileName()).isEqualTo("mypackage/module/MyClass.method.schema.json");
        assertThat(new SchemaCatalog().describe(result.getPath()).getTitle()).isEqualTo("Deep");
    }

    @Test
    void testVariantFallsBackToPlainForm() throws IOException {
        SchemaFileWriter writer = new SchemaFileWriter();
        writer.writeMethodSchema(tempDir, "User", "create", Map.of("type", "object"));
        writer.write(tempDir, "User.create", "example", FileKind.PLAIN, List.of(Map.of("name", "Ann")));

        SchemaResolver resolver = new SchemaResolver(tempDir);
        ObjectPath path = new ObjectPathParser().parseMethod("app.models.User.create");

        ResolutionResult examples = resolver.resolve(path, new ResolverConfigLoader().fromMap(Map.of(), null)
                .getSearchPolicy(), LookupOptions.forVariant("example"));
        ResolutionResult options = resolver.resolve(path, ResolverConfig.defaults().getSearchPolicy(),
                LookupOptions.forVariant("options"));

        assertThat(examples.getCandidate().getFileName()).isEqualTo("User.create.example.json");
        assertThat(examples.isSchemaTyped()).isFalse();
        assertThat(options.getCandidate().getFileName()).isEqualTo("User.create.schema.json");
        assertThat(options.getAttempted()).hasSize(3);
    }

    @Test
    void testIndexListsWrittenSchemas() throws IOException {
        SchemaFileWriter writer = new SchemaFileWriter();
        writer.writeMethodSchema(tempDir, "Order", "submit", Map.of("title", "Submit order", "type", "object",
                "properties", Map.of("id", Map.of("type", "string"))));
        writer.writeFunctionSchema(tempDir, "ping", Map.of("type", "null"));

        String rst = new SchemaIndexRenderer().render(tempDir);

        assertThat(rst).contains("**Order.submit.schema.json**", ":Title: Submit order", ":Properties: id",
                "**ping.schema.json**", ":Type: null");
    }
}
