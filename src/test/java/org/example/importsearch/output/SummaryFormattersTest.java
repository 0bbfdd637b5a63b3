package org.example.importsearch.output;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the text, JSON and console formatters.
 */
class SummaryFormattersTest {

    private SearchReport report;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> summary = new LinkedHashMap<>();
        summary.put("main.py", List.of("utils.py", "json"));
        summary.put("utils.py", List.of("os"));
        report = new SearchReport("main.py", summary,
                List.of("main.py", "utils.py"),
                List.of("|-main.py", "  |-utils.py", "    |-os", "  |-json"));
    }

    @Nested
    @DisplayName("Text")
    class Text {

        @Test
        @DisplayName("should render summary, visited files and tree")
        void shouldRenderTextBlock() {
            String expected = "\nFile: main.py\n"
                    + "['utils.py', 'json']\n"
                    + "-----------------------\n"
                    + "\nFile: utils.py\n"
                    + "['os']\n"
                    + "-----------------------\n"
                    + "\nVisited files: ['main.py', 'utils.py']\n"
                    + "-----------------------\n"
                    + "import-tree\n\n"
                    + "|-main.py\n"
                    + "  |-utils.py\n"
                    + "    |-os\n"
                    + "  |-json\n";

            assertThat(new TextSummaryFormatter().format(report)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should render empty list literal")
        void shouldRenderEmptyListLiteral() {
            assertThat(TextSummaryFormatter.toListLiteral(List.of())).isEqualTo("[]");
        }
    }

    @Nested
    @DisplayName("Json")
    class Json {

        @Test
        @DisplayName("should render indented document")
        void shouldRenderIndentedDocument() {
            String expected = "{\n"
                    + "  \"summary\": {\n"
                    + "    \"main.py\": [\n"
                    + "      \"utils.py\",\n"
                    + "      \"json\"\n"
                    + "    ],\n"
                    + "    \"utils.py\": [\n"
                    + "      \"os\"\n"
                    + "    ]\n"
                    + "  },\n"
                    + "  \"visited\": [\n"
                    + "    \"main.py\",\n"
                    + "    \"utils.py\"\n"
                    + "  ]\n"
                    + "}";

            assertThat(new JsonSummaryFormatter().format(report)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Console")
    class Console {

        @Test
        @DisplayName("should render table, visited box and tree")
        void shouldRenderConsoleOutput() {
            String output = new ConsoleSummaryFormatter().format(report);

            assertThat(output).contains("Import Summary");
            assertThat(output).contains("│ File     │ Dependencies │");
            assertThat(output).contains("│ main.py  │ utils.py     │");
            assertThat(output).contains("│          │ json         │");
            assertThat(output).contains("│ utils.py │ os           │");
            assertThat(output).contains(" Visited Files ");
            assertThat(output).contains("─ Import Tree ─");
            assertThat(output).endsWith("|-main.py\n  |-utils.py\n    |-os\n  |-json\n");
        }

        @Test
        @DisplayName("should show placeholders for empty report")
        void shouldRenderEmptyReport() {
            SearchReport empty = new SearchReport("main.py", Map.of(), List.of(), List.of());

            String output = new ConsoleSummaryFormatter().format(empty);

            assertThat(output).contains("│ None" + " ".repeat(13) + "│");
            assertThat(output).endsWith("No import tree to display\n");
        }
    }
}
