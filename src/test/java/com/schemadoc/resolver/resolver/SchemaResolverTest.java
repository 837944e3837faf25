package com.schemadoc.resolver.resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemadoc.resolver.model.Candidate;
import com.schemadoc.resolver.model.FileKind;
import com.schemadoc.resolver.model.LookupOptions;
import com.schemadoc.resolver.model.ObjectPath;
import com.schemadoc.resolver.model.PathSeparator;
import com.schemadoc.resolver.model.SearchPolicy;
import com.schemadoc.resolver.parser.ObjectPathParser;
import com.schemadoc.resolver.pattern.PatternGenerator;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaResolver.
 */
class SchemaResolverTest {

    @TempDir
    Path tempDir;

    private final ObjectPathParser parser = new ObjectPathParser();

    private static void touch(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testMemberOnlyFileFoundAfterHigherPriorityMisses() throws IOException {
        touch(tempDir.resolve("similar.schema.json"), "{\"type\": \"object\"}");
        ObjectPath path = parser.parseMethod("perekrestok_api.endpoints.catalog.ProductService.similar");

        ResolutionResult result = new SchemaResolver(tempDir).resolve(path, SearchPolicy.defaults());

        assertThat(result.isFound()).isTrue();
        assertThat(result.getPath()).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("similar.schema.json"));
        assertThat(result.getFileKind()).isEqualTo(FileKind.SCHEMA);
        assertThat(result.isSchemaTyped()).isTrue();
        assertThat(result.getAttempted()).hasSize(7);
        assertThat(result.getAttemptedFileNames()).last().isEqualTo("similar.schema.json");
    }

    @Test
    void testHighestPriorityWins() throws IOException {
        touch(tempDir.resolve("MyClass.method.json"), "{}");
        touch(tempDir.resolve("MyClass.method.schema.json"), "{}");
        touch(tempDir.resolve("method.schema.json"), "{}");

        ResolutionResult result = new SchemaResolver(tempDir)
                .resolve(parser.parseMethod("pkg.MyClass.method"), SearchPolicy.defaults());

        assertThat(result.getCandidate().getFileName()).isEqualTo("MyClass.method.schema.json");
        assertThat(result.getAttempted()).hasSize(1);
    }

    @Test
    void testPlainKindMatch() throws IOException {
        touch(tempDir.resolve("helper.json"), "{\"example\": 1}");

        ResolutionResult result = new SchemaResolver(tempDir)
                .resolve(parser.parseFunction("pkg.helper"), SearchPolicy.defaults());

        assertThat(result.isFound()).isTrue();
        assertThat(result.getFileKind()).isEqualTo(FileKind.PLAIN);
        assertThat(result.isSchemaTyped()).isFalse();
    }

    @Test
    void testSubdirectoryMatchWithSlashSeparator() throws IOException {
        touch(tempDir.resolve("endpoints/catalog/ProductService.similar.schema.json"), "{}");
        SearchPolicy policy = SearchPolicy.builder().pathToFileSeparator(PathSeparator.SLASH).build();

        ResolutionResult result = new SchemaResolver(tempDir)
                .resolve(parser.parseMethod("api.endpoints.catalog.ProductService.similar"), policy);

        assertThat(result.isFound()).isTrue();
        assertThat(result.getCandidate().getFileName()).isEqualTo("endpoints/catalog/ProductService.similar.schema.json");
    }

    @Test
    void testRegularFileInCandidatePathIsAMiss() throws IOException {
        touch(tempDir.resolve("endpoints"), "not a directory");
        touch(tempDir.resolve("similar.schema.json"), "{}");
        SearchPolicy policy = SearchPolicy.builder().pathToFileSeparator(PathSeparator.SLASH).build();

        ResolutionResult result = new SchemaResolver(tempDir)
                .resolve(parser.parseMethod("api.endpoints.catalog.ProductService.similar"), policy);

        assertThat(result.isFound()).isTrue();
        assertThat(result.getCandidate().getFileName()).isEqualTo("similar.schema.json");
        assertThat(result.getAttemptedFileNames())
                .contains("endpoints/catalog/ProductService.similar.schema.json");
    }

    @Test
    void testRegularFileAncestorIsDetected() throws IOException {
        touch(tempDir.resolve("endpoints"), "x");

        assertThat(FilesystemProbe.crossesRegularFile(tempDir.resolve("endpoints/catalog/A.b.schema.json"))).isTrue();
        assertThat(FilesystemProbe.crossesRegularFile(tempDir.resolve("missing/A.b.schema.json"))).isFalse();
        assertThat(FilesystemProbe.INSTANCE.exists(tempDir.resolve("endpoints/A.b.schema.json"))).isFalse();
    }

    @Test
    void testVariantMatch() throws IOException {
        touch(tempDir.resolve("MyClass.method.schema.json"), "{}");
        touch(tempDir.resolve("MyClass.method.options.schema.json"), "{}");

        ResolutionResult result = new SchemaResolver(tempDir).resolve(parser.parseMethod("pkg.MyClass.method"),
                SearchPolicy.defaults(), LookupOptions.forVariant("options"));

        assertThat(result.getCandidate().getVariant()).isEqualTo("options");
        assertThat(result.getPath().getFileName().toString()).isEqualTo("MyClass.method.options.schema.json");
    }

    @Test
    void testNotFoundReportsEveryCandidate() throws IOException {
        ObjectPath path = parser.parseMethod("mypackage.module.MyClass.method");

        ResolutionResult result = new SchemaResolver(tempDir).resolve(path, SearchPolicy.defaults());

        assertThat(result.isFound()).isFalse();
        assertThat(result.getCandidate()).isNull();
        assertThat(result.getPath()).isNull();
        assertThat(result.getFileKind()).isNull();
        assertThat(result.getAttemptedFileNames())
                .isEqualTo(new PatternGenerator().generateFileNames(path, SearchPolicy.defaults(), LookupOptions.defaults()));
    }

    @Test
    void testMissingDirectoryIsNotFound() throws IOException {
        SchemaResolver resolver = new SchemaResolver(tempDir.resolve("does-not-exist"));

        ResolutionResult result = resolver.resolve(parser.parseFunction("f"), SearchPolicy.defaults());

        assertThat(result.isFound()).isFalse();
        assertThat(result.getAttempted()).hasSize(2);
    }

    @Test
    void testDirectoryWithCandidateNameIsNotAMatch() throws IOException {
        Files.createDirectories(tempDir.resolve("helper.schema.json"));
        touch(tempDir.resolve("helper.json"), "{}");

        ResolutionResult result = new SchemaResolver(tempDir)
                .resolve(parser.parseFunction("helper"), SearchPolicy.defaults());

        assertThat(result.getCandidate().getFileName()).isEqualTo("helper.json");
    }

    @Test
    void testListenerSeesEveryProbeInOrder() throws IOException {
        touch(tempDir.resolve("method.json"), "{}");
        List<String> seen = new ArrayList<>();
        ProbeListener listener = (attempt, candidate, file, matched) ->
                seen.add(attempt + ":" + candidate.getFileName() + ":" + matched);

        new SchemaResolver(tempDir, listener).resolve(parser.parseMethod("pkg.MyClass.method"), SearchPolicy.defaults());

        assertThat(seen).containsExactly(
                "1:MyClass.method.schema.json:false",
                "2:MyClass.method.json:false",
                "3:method.schema.json:false",
                "4:method.json:true");
    }

    @Test
    void testProbeErrorAbortsResolution() {
        SchemaFileProbe failing = file -> {
            if (file.getFileName().toString().equals("MyClass.method.json")) {
                throw new AccessDeniedException(file.toString());
            }
            return false;
        };
        SchemaResolver resolver = new SchemaResolver(tempDir, ProbeListener.NONE, failing, new PatternGenerator());

        assertThatThrownBy(() -> resolver.resolve(parser.parseMethod("pkg.MyClass.method"), SearchPolicy.defaults()))
                .isInstanceOf(ProbeFailedException.class)
                .hasCauseInstanceOf(AccessDeniedException.class)
                .satisfies(e -> assertThat(((ProbeFailedException) e).getCandidate().getFileName())
                        .isEqualTo("MyClass.method.json"));
    }

    @Test
    void testCandidateEscapingDirectoryIsSkipped() throws IOException {
        Path schemaDir = tempDir.resolve("schemas");
        Files.createDirectories(schemaDir);
        touch(tempDir.resolve("outside.schema.json"), "{}");
        List<Candidate> candidates = List.of(Candidate.of("../outside", null, FileKind.SCHEMA));

        ResolutionResult result = new SchemaResolver(schemaDir).resolve(candidates);

        assertThat(result.isFound()).isFalse();
        assertThat(result.getAttempted()).hasSize(1);
    }

    @Test
    void testReadBytes() throws IOException {
        touch(tempDir.resolve("helper.schema.json"), "{\"title\": \"Helper\"}");
        SchemaResolver resolver = new SchemaResolver(tempDir);

        ResolutionResult result = resolver.resolve(parser.parseFunction("helper"), SearchPolicy.defaults());

        assertThat(new String(resolver.readBytes(result), StandardCharsets.UTF_8)).isEqualTo("{\"title\": \"Helper\"}");
    }

    @Test
    void testReadBytesRequiresMatch() {
        ResolutionResult notFound = ResolutionResult.notFound(List.of());

        assertThatThrownBy(() -> new SchemaResolver(tempDir).readBytes(notFound))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testReadBytesOfDeletedFile() throws IOException {
        Path file = tempDir.resolve("helper.schema.json");
        touch(file, "{}");
        SchemaResolver resolver = new SchemaResolver(tempDir);
        ResolutionResult result = resolver.resolve(parser.parseFunction("helper"), SearchPolicy.defaults());
        Files.delete(file);

        assertThatThrownBy(() -> resolver.readBytes(result)).isInstanceOf(ProbeFailedException.class);
    }
}
