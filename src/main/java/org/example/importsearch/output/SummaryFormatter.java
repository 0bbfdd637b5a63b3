package org.example.importsearch.output;

/**
 * Interface for search report formatters.
 * Implementations render a report in one specific {@link OutputFormat}.
 */
public interface SummaryFormatter {

    /**
     * Renders the report.
     *
     * @param report the finished search
     * @return the formatted content
     */
    String format(SearchReport report);

    /**
     * Returns the format this formatter produces.
     */
    OutputFormat getFormat();

    /**
     * Creates the formatter for a format.
     */
    static SummaryFormatter forFormat(OutputFormat format) {
        return switch (format) {
            case PRINT -> new ConsoleSummaryFormatter();
            case TEXT -> new TextSummaryFormatter();
            case JSON -> new JsonSummaryFormatter();
        };
    }
}
