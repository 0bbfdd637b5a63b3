package org.example.importsearch;

import org.example.importsearch.model.DependencyGraph;
import org.example.importsearch.output.SearchReport;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of an import search run.
 */
public class SearchResult {

    private final DependencyGraph graph;
    private final SearchReport report;
    private final String renderedOutput;
    private final Path outputFile;
    private final String writeError;
    private final long executionTimeMs;

    private SearchResult(Builder builder) {
        this.graph = builder.graph;
        this.report = builder.report;
        this.renderedOutput = builder.renderedOutput;
        this.outputFile = builder.outputFile;
        this.writeError = builder.writeError;
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public SearchReport getReport() {
        return report;
    }

    /**
     * Returns the formatted output in the requested format.
     */
    public String getRenderedOutput() {
        return renderedOutput;
    }

    /**
     * Returns the file the output was written to, empty for console output or a failed write.
     */
    public Optional<Path> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }

    /**
     * Returns the message of a failed write. A failed write does not fail the search.
     */
    public Optional<String> getWriteError() {
        return Optional.ofNullable(writeError);
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @Override
    public String toString() {
        return String.format(
                "SearchResult{visited=%d, files=%d, dependencies=%d, output=%s, time=%dms}",
                graph.getVisited().size(), graph.getFileCount(), graph.getDependencyCount(),
                writeError != null ? "failed" : outputFile, executionTimeMs
        );
    }

    public static class Builder {
        private DependencyGraph graph;
        private SearchReport report;
        private String renderedOutput;
        private Path outputFile;
        private String writeError;
        private long executionTimeMs;

        public Builder graph(DependencyGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder report(SearchReport report) {
            this.report = report;
            return this;
        }

        public Builder renderedOutput(String renderedOutput) {
            this.renderedOutput = renderedOutput;
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder writeError(String writeError) {
            this.writeError = writeError;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public SearchResult build() {
            return new SearchResult(this);
        }
    }
}
