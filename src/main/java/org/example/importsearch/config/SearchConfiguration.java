package org.example.importsearch.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Search configuration model.
 * Contains all parameters of one import search run.
 */
public class SearchConfiguration {

    /**
     * Entry file, absolute or relative to the root path.
     */
    private Path entryFile;

    /**
     * Root directory dotted module names are resolved against.
     */
    private Path rootPath;

    /**
     * Output format: "print", "text" or "json".
     * Default: "print"
     */
    private String outputFormat = "print";

    /**
     * Output path. The format's suffix replaces any suffix it carries.
     * Default: "output"
     */
    private Path outputFile = Path.of("output");

    /**
     * Whether skipped files and written outputs are logged at INFO level.
     * Default: false
     */
    private boolean verbose = false;

    // Constructors

    public SearchConfiguration() {
    }

    // Builder pattern for easy construction
    public static Builder builder() {
        return new Builder();
    }

    // Getters and Setters

    public Path getEntryFile() {
        return entryFile;
    }

    public void setEntryFile(Path entryFile) {
        this.entryFile = entryFile;
    }

    public Path getRootPath() {
        return rootPath;
    }

    public void setRootPath(Path rootPath) {
        this.rootPath = rootPath;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(Path outputFile) {
        this.outputFile = outputFile;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchConfiguration that = (SearchConfiguration) o;
        return verbose == that.verbose &&
                Objects.equals(entryFile, that.entryFile) &&
                Objects.equals(rootPath, that.rootPath) &&
                Objects.equals(outputFormat, that.outputFormat) &&
                Objects.equals(outputFile, that.outputFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryFile, rootPath, outputFormat, outputFile, verbose);
    }

    @Override
    public String toString() {
        return "SearchConfiguration{" +
                "entryFile=" + entryFile +
                ", rootPath=" + rootPath +
                ", outputFormat='" + outputFormat + '\'' +
                ", outputFile=" + outputFile +
                ", verbose=" + verbose +
                '}';
    }

    /**
     * Builder for SearchConfiguration.
     */
    public static class Builder {
        private final SearchConfiguration config = new SearchConfiguration();

        public Builder entryFile(Path entryFile) {
            config.setEntryFile(entryFile);
            return this;
        }

        public Builder rootPath(Path rootPath) {
            config.setRootPath(rootPath);
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            config.setOutputFormat(outputFormat);
            return this;
        }

        public Builder outputFile(Path outputFile) {
            config.setOutputFile(outputFile);
            return this;
        }

        public Builder verbose(boolean verbose) {
            config.setVerbose(verbose);
            return this;
        }

        public SearchConfiguration build() {
            return config;
        }
    }
}
