package org.example.importsearch.output;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats a report as a plain text block.
 *
 * <pre>
 * File: main.py
 * ['utils.py', 'json']
 * -----------------------
 *
 * Visited files: ['main.py', 'utils.py']
 * -----------------------
 * import-tree
 *
 * |-main.py
 *   |-utils.py
 *   |-json
 * </pre>
 */
public class TextSummaryFormatter implements SummaryFormatter {

    static final String SEPARATOR = "-----------------------";

    @Override
    public String format(SearchReport report) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : report.getSummary().entrySet()) {
            sb.append("\nFile: ").append(entry.getKey()).append("\n");
            sb.append(toListLiteral(entry.getValue())).append("\n");
            sb.append(SEPARATOR).append("\n");
        }
        sb.append("\nVisited files: ").append(toListLiteral(report.getVisited())).append("\n");
        sb.append(SEPARATOR).append("\n");
        sb.append("import-tree\n\n");
        for (String line : report.getTree()) {
            sb.append(line).append("\n");
        }
        return sb.toString();
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.TEXT;
    }

    static String toListLiteral(List<String> values) {
        return values.stream()
                .map(v -> "'" + v + "'")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
