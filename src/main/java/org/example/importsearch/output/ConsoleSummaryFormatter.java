package org.example.importsearch.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats a report for the console: a bordered table of files and their
 * dependencies, a box with the visited files and the import tree.
 */
public class ConsoleSummaryFormatter implements SummaryFormatter {

    private static final String NONE = "None";

    @Override
    public String format(SearchReport report) {
        List<String> lines = new ArrayList<>();
        appendSummaryTable(report, lines);
        lines.add("");
        appendVisitedBox(report, lines);
        lines.add("");
        lines.add(rule("Import Tree", tableWidth(report)));
        if (report.getTree().isEmpty()) {
            lines.add("No import tree to display");
        } else {
            lines.addAll(report.getTree());
        }
        return String.join("\n", lines) + "\n";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.PRINT;
    }

    private void appendSummaryTable(SearchReport report, List<String> lines) {
        int[] widths = columnWidths(report);
        int fileWidth = widths[0];
        int depWidth = widths[1];

        lines.add(center("Import Summary", fileWidth + depWidth + 7));
        lines.add("╭" + "─".repeat(fileWidth + 2) + "┬" + "─".repeat(depWidth + 2) + "╮");
        lines.add(row("File", "Dependencies", fileWidth, depWidth));

        for (Map.Entry<String, List<String>> entry : report.getSummary().entrySet()) {
            lines.add("├" + "─".repeat(fileWidth + 2) + "┼" + "─".repeat(depWidth + 2) + "┤");
            List<String> dependencies = dependencyCell(entry.getValue());
            for (int i = 0; i < dependencies.size(); i++) {
                String file = i == 0 ? entry.getKey() : "";
                lines.add(row(file, dependencies.get(i), fileWidth, depWidth));
            }
        }
        lines.add("╰" + "─".repeat(fileWidth + 2) + "┴" + "─".repeat(depWidth + 2) + "╯");
    }

    private void appendVisitedBox(SearchReport report, List<String> lines) {
        List<String> visited = report.getVisited().isEmpty() ? List.of(NONE) : report.getVisited();
        String title = " Visited Files ";
        int width = title.length();
        for (String file : visited) {
            width = Math.max(width, file.length());
        }
        int left = (width + 2 - title.length()) / 2;
        int right = width + 2 - title.length() - left;
        lines.add("╭" + "─".repeat(left) + title + "─".repeat(right) + "╮");
        for (String file : visited) {
            lines.add("│ " + pad(file, width) + " │");
        }
        lines.add("╰" + "─".repeat(width + 2) + "╯");
    }

    private List<String> dependencyCell(List<String> dependencies) {
        return dependencies.isEmpty() ? List.of(NONE) : dependencies;
    }

    private int tableWidth(SearchReport report) {
        int[] widths = columnWidths(report);
        return widths[0] + widths[1] + 7;
    }

    /**
     * Returns the width of the file column and of the dependency column.
     */
    private int[] columnWidths(SearchReport report) {
        int fileWidth = "File".length();
        int depWidth = "Dependencies".length();
        for (Map.Entry<String, List<String>> entry : report.getSummary().entrySet()) {
            fileWidth = Math.max(fileWidth, entry.getKey().length());
            for (String dependency : dependencyCell(entry.getValue())) {
                depWidth = Math.max(depWidth, dependency.length());
            }
        }
        return new int[] {fileWidth, depWidth};
    }

    private String row(String file, String dependency, int fileWidth, int depWidth) {
        return "│ " + pad(file, fileWidth) + " │ " + pad(dependency, depWidth) + " │";
    }

    private String rule(String title, int width) {
        String label = " " + title + " ";
        int side = Math.max(2, (width - label.length()) / 2);
        return "─".repeat(side) + label + "─".repeat(side);
    }

    private String center(String text, int width) {
        int left = Math.max(0, (width - text.length()) / 2);
        return " ".repeat(left) + text;
    }

    private String pad(String text, int width) {
        return text + " ".repeat(Math.max(0, width - text.length()));
    }
}
