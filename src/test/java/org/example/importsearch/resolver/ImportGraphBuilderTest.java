package org.example.importsearch.resolver;

import org.example.importsearch.exception.ImportParseException;
import org.example.importsearch.model.Dependency;
import org.example.importsearch.model.DependencyGraph;
import org.example.importsearch.model.PathNames;
import org.example.importsearch.parser.ImportExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ImportGraphBuilder.
 */
class ImportGraphBuilderTest {

    @TempDir
    Path root;

    private Path write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private DependencyGraph search(String entry) throws ImportParseException {
        return new ImportGraphBuilder(root, false).resolve(Path.of(entry));
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("should follow resolved dependencies transitively")
        void shouldFollowResolvedDependencies() throws IOException, ImportParseException {
            write("module_b.py", "import json\n");
            write("module_a.py", "import module_b\n");
            write("main.py", "import module_a\nimport json\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.toSummary()).containsExactly(
                    entry("main.py", List.of("module_a.py", "json")),
                    entry("module_a.py", List.of("module_b.py")),
                    entry("module_b.py", List.of("json")));
            assertThat(graph.getSortedVisited()).containsExactly("main.py", "module_a.py", "module_b.py");
        }

        @Test
        @DisplayName("should visit exactly the reachable files")
        void shouldVisitExactlyReachableFiles() throws IOException, ImportParseException {
            write("main.py", "import a\nfrom pkg import b\n");
            write("a.py", "import os\n");
            write("pkg/__init__.py", "");
            write("pkg/b.py", "from . import c\n");
            write("pkg/c.py", "x = 1\n");
            write("unreachable.py", "import a\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.getSortedVisited())
                    .containsExactly("a.py", "main.py", "pkg/b.py", "pkg/c.py");
        }

        @Test
        @DisplayName("should not record files without imports")
        void shouldNotRecordFilesWithoutImports() throws IOException, ImportParseException {
            write("main.py", "import leaf\n");
            write("leaf.py", "VALUE = 1\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.toSummary()).containsOnlyKeys("main.py");
            assertThat(graph.getSortedVisited()).containsExactly("leaf.py", "main.py");
        }

        @Test
        @DisplayName("should expand siblings in declaration order")
        void shouldExpandSiblingsInDeclarationOrder() throws IOException, ImportParseException {
            write("main.py", "import first\nimport second\n");
            write("first.py", "import shared\n");
            write("second.py", "import shared\n");
            write("shared.py", "import os\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.getDependencies().keySet()).extracting(p -> PathNames.relativize(p, graph.getRootPath()))
                    .containsExactly("main.py", "first.py", "shared.py", "second.py");
        }

        @Test
        @DisplayName("should record unresolved imports without traversing them")
        void shouldRecordUnresolvedImports() throws IOException, ImportParseException {
            write("main.py", "import requests\nfrom collections import OrderedDict\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.getDependenciesOf(root.resolve("main.py")))
                    .containsExactly(Dependency.external("requests"), Dependency.external("collections"));
            assertThat(graph.getSortedVisited()).containsExactly("main.py");
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("should terminate on two-file cycle")
        void shouldTerminateOnTwoFileCycle() throws IOException, ImportParseException {
            write("a.py", "import b\n");
            write("b.py", "import a\n");

            DependencyGraph graph = search("a.py");

            assertThat(graph.getSortedVisited()).containsExactly("a.py", "b.py");
            assertThat(graph.toSummary()).containsEntry("a.py", List.of("b.py"));
            assertThat(graph.toSummary()).containsEntry("b.py", List.of("a.py"));
        }

        @Test
        @DisplayName("should terminate on self import")
        void shouldTerminateOnSelfImport() throws IOException, ImportParseException {
            write("loop.py", "import loop\n");

            DependencyGraph graph = search("loop.py");

            assertThat(graph.getSortedVisited()).containsExactly("loop.py");
            assertThat(graph.toSummary()).containsEntry("loop.py", List.of("loop.py"));
        }

        @Test
        @DisplayName("should extract each file only once")
        void shouldExtractEachFileOnlyOnce() throws IOException, ImportParseException {
            Path a = write("a.py", "import b\nimport c\n");
            Path b = write("b.py", "import c\nimport a\n");
            Path c = write("c.py", "import a\nimport b\n");
            ImportExtractor extractor = spy(new ImportExtractor());
            ImportGraphBuilder builder = new ImportGraphBuilder(root, extractor, new ModuleResolver(root), false);

            builder.resolve(a);

            verify(extractor, times(1)).extract(a);
            verify(extractor, times(1)).extract(b);
            verify(extractor, times(1)).extract(c);
            verify(extractor, times(3)).extract(any(Path.class));
        }
    }

    @Nested
    @DisplayName("Missing Files And Errors")
    class MissingFilesAndErrors {

        @Test
        @DisplayName("should return empty graph for missing entry file")
        void shouldReturnEmptyGraphForMissingEntry() throws ImportParseException {
            DependencyGraph graph = new ImportGraphBuilder(root, true).resolve(Path.of("missing.py"));

            assertThat(graph.getVisited()).isEmpty();
            assertThat(graph.getDependencies()).isEmpty();
        }

        @Test
        @DisplayName("should propagate parse failure")
        void shouldPropagateParseFailure() throws IOException {
            write("main.py", "import broken\n");
            write("broken.py", "from import nothing\n");

            assertThatThrownBy(() -> search("main.py"))
                    .isInstanceOf(ImportParseException.class)
                    .hasMessageContaining("broken.py");
        }
    }

    @Nested
    @DisplayName("Symbolic Links")
    class SymbolicLinks {

        @Test
        @DisplayName("should visit file reached through linked directory once")
        void shouldVisitLinkedFileOnce() throws IOException, ImportParseException {
            write("real/mod.py", "import os\n");
            Files.createSymbolicLink(root.resolve("link"), root.resolve("real"));
            write("main.py", "import real.mod\nimport link.mod\n");

            DependencyGraph graph = search("main.py");

            assertThat(graph.getSortedVisited()).containsExactly("main.py", "real/mod.py");
            assertThat(graph.toSummary()).containsEntry("main.py", List.of("real/mod.py", "real/mod.py"));
        }

        @Test
        @DisplayName("should resolve linked root")
        void shouldResolveLinkedRoot() throws IOException, ImportParseException {
            write("project/main.py", "import helper\n");
            write("project/helper.py", "");
            Path linkedRoot = Files.createSymbolicLink(root.resolve("linked"), root.resolve("project"));

            DependencyGraph graph = new ImportGraphBuilder(linkedRoot, false).resolve(Path.of("main.py"));

            assertThat(graph.getSortedVisited()).containsExactly("helper.py", "main.py");
            assertThat(graph.toSummary()).containsEntry("main.py", List.of("helper.py"));
        }
    }

    @Nested
    @DisplayName("Entry File Coercion")
    class EntryFileCoercion {

        @Test
        @DisplayName("should resolve relative entry against root")
        void shouldResolveRelativeEntry() {
            ImportGraphBuilder builder = new ImportGraphBuilder(root, false);

            assertThat(builder.coerceEntryFile(Path.of("app/main.py"))).isEqualTo(root.resolve("app/main.py"));
        }

        @Test
        @DisplayName("should append source suffix")
        void shouldAppendSourceSuffix() {
            ImportGraphBuilder builder = new ImportGraphBuilder(root, false);

            assertThat(builder.coerceEntryFile(Path.of("main"))).isEqualTo(root.resolve("main.py"));
            assertThat(builder.coerceEntryFile(root.resolve("main.txt"))).isEqualTo(root.resolve("main.py"));
        }

        @Test
        @DisplayName("should use initializer of package directory")
        void shouldUseInitializerOfPackage() throws IOException {
            write("pkg/__init__.py", "");
            ImportGraphBuilder builder = new ImportGraphBuilder(root, false);

            assertThat(builder.coerceEntryFile(Path.of("pkg"))).isEqualTo(root.resolve("pkg/__init__.py"));
        }
    }

    @Nested
    @DisplayName("Fixture Project")
    class FixtureProject {

        @Test
        @DisplayName("should build expected graph for dependency demo")
        void shouldBuildExpectedGraph() throws URISyntaxException, ImportParseException {
            Path fixtureRoot = Path.of(getClass().getResource("/fixtures/dependency_demo").toURI());

            DependencyGraph graph = new ImportGraphBuilder(fixtureRoot, false).resolve(Path.of("entry.py"));
            Map<String, List<String>> summary = graph.toSummary();

            assertThat(summary).containsExactly(
                    entry("entry.py", List.of("pkg/alpha.py", "utilities/logger.py")),
                    entry("pkg/alpha.py", List.of("pkg/beta.py", "pkg/shared/helpers.py")),
                    entry("pkg/beta.py", List.of("utilities/logger.py")),
                    entry("utilities/logger.py", List.of("utilities/formatters/json_formatter.py")),
                    entry("utilities/formatters/json_formatter.py", List.of("json")));
            assertThat(graph.getSortedVisited()).containsExactly(
                    "entry.py",
                    "pkg/alpha.py",
                    "pkg/beta.py",
                    "pkg/shared/helpers.py",
                    "utilities/formatters/json_formatter.py",
                    "utilities/logger.py");
        }
    }
}
