package org.example.importsearch;

import org.example.importsearch.config.SearchConfiguration;
import org.example.importsearch.exception.ConfigurationException;
import org.example.importsearch.exception.ImportParseException;
import org.example.importsearch.exception.ImportSearchException;
import org.example.importsearch.exception.OutputException;
import org.example.importsearch.output.OutputFormat;
import org.example.importsearch.output.SummaryWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ImportSearch.
 */
@ExtendWith(MockitoExtension.class)
class ImportSearchTest {

    @TempDir
    Path root;

    @Mock
    private SummaryWriter writer;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("main.py"), "import utils\nimport json\n");
        Files.writeString(root.resolve("utils.py"), "import os\n");
    }

    private SearchConfiguration.Builder config(String format) {
        return SearchConfiguration.builder()
                .entryFile(Path.of("main.py"))
                .rootPath(root)
                .outputFormat(format)
                .outputFile(root.resolve("out/output"));
    }

    @Nested
    @DisplayName("Output Formats")
    class OutputFormats {

        @Test
        @DisplayName("should print without writing a file")
        void shouldPrintWithoutFile() throws ImportSearchException {
            SearchResult result = new ImportSearch(config("print").build()).run();

            assertThat(result.getOutputFile()).isEmpty();
            assertThat(result.getRenderedOutput()).contains("Import Summary").contains("|-main.py");
            assertThat(Files.exists(root.resolve("out"))).isFalse();
        }

        @Test
        @DisplayName("should write json file")
        void shouldWriteJsonFile() throws ImportSearchException, IOException {
            SearchResult result = new ImportSearch(config("json").build()).run();

            Path expected = root.resolve("out/output.json");
            assertThat(result.getOutputFile()).contains(expected);
            assertThat(Files.readString(expected))
                    .isEqualTo(result.getRenderedOutput())
                    .contains("\"main.py\": [")
                    .contains("\"utils.py\",");
        }

        @Test
        @DisplayName("should write text file")
        void shouldWriteTextFile() throws ImportSearchException, IOException {
            SearchResult result = new ImportSearch(config("text").build()).run();

            Path expected = root.resolve("out/output.txt");
            assertThat(Files.readString(expected))
                    .contains("File: main.py\n['utils.py', 'json']\n")
                    .contains("Visited files: ['main.py', 'utils.py']")
                    .endsWith("|-main.py\n  |-utils.py\n    |-os\n  |-json\n");
            assertThat(result.getWriteError()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Result")
    class Result {

        @Test
        @DisplayName("should expose graph and report")
        void shouldExposeGraphAndReport() throws ImportSearchException {
            SearchResult result = new ImportSearch(config("print").build()).run();

            assertThat(result.getGraph().getSortedVisited()).containsExactly("main.py", "utils.py");
            assertThat(result.getReport().getSummary())
                    .containsEntry("main.py", List.of("utils.py", "json"))
                    .containsEntry("utils.py", List.of("os"));
            assertThat(result.getExecutionTimeMs()).isGreaterThanOrEqualTo(0);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should record write failure and still succeed")
        void shouldRecordWriteFailure() throws ImportSearchException {
            when(writer.write(anyString(), any(Path.class), eq(OutputFormat.JSON)))
                    .thenThrow(new OutputException("Error writing to output.json: denied"));

            SearchResult result = new ImportSearch(config("json").build(), writer).run();

            assertThat(result.getOutputFile()).isEmpty();
            assertThat(result.getWriteError()).contains("Error writing to output.json: denied");
            assertThat(result.getRenderedOutput()).contains("\"visited\"");
        }

        @Test
        @DisplayName("should reject invalid configuration before searching")
        void shouldRejectInvalidConfiguration() {
            SearchConfiguration config = config("yaml").build();

            assertThatThrownBy(() -> new ImportSearch(config, writer).run())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Unknown output format: yaml");
            verifyNoInteractions(writer);
        }

        @Test
        @DisplayName("should propagate parse failure")
        void shouldPropagateParseFailure() throws IOException {
            Files.writeString(root.resolve("utils.py"), "import (\n");

            assertThatThrownBy(() -> new ImportSearch(config("print").build()).run())
                    .isInstanceOf(ImportParseException.class);
        }
    }
}
