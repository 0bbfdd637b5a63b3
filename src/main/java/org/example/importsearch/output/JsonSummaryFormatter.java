package org.example.importsearch.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Formats a report as a JSON document with two-space indentation:
 * {@code {"summary": {file: [dependency, ...]}, "visited": [file, ...]}}.
 */
public class JsonSummaryFormatter implements SummaryFormatter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ObjectWriter writer;

    public JsonSummaryFormatter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = OBJECT_MAPPER.writer(printer);
    }

    @Override
    public String format(SearchReport report) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();

        ObjectNode summary = root.putObject("summary");
        for (Map.Entry<String, List<String>> entry : report.getSummary().entrySet()) {
            ArrayNode dependencies = summary.putArray(entry.getKey());
            entry.getValue().forEach(dependencies::add);
        }

        ArrayNode visited = root.putArray("visited");
        report.getVisited().forEach(visited::add);

        try {
            return writer.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search report: " + e.getMessage(), e);
        }
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }
}
