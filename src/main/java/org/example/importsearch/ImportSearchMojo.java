package org.example.importsearch;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.example.importsearch.config.SearchConfiguration;
import org.example.importsearch.exception.ConfigurationException;
import org.example.importsearch.exception.ImportParseException;
import org.example.importsearch.exception.ImportSearchException;

import java.io.File;

/**
 * Discovers the Python import graph reachable from an entry file and prints
 * it as a summary and a tree, optionally writing it to a text or JSON file.
 *
 * Usage: mvn importsearch:search -Dimportsearch.entryFile=main.py
 */
@Mojo(name = "search", requiresProject = false, threadSafe = true)
public class ImportSearchMojo extends AbstractMojo {

    // ========== Required Configuration ==========

    /**
     * Entry Python file, relative to rootPath unless absolute.
     */
    @Parameter(property = "importsearch.entryFile", required = true)
    private String entryFile;

    // ========== Optional Configuration ==========

    /**
     * Root directory module names are resolved against.
     */
    @Parameter(property = "importsearch.rootPath", defaultValue = "${basedir}")
    private File rootPath;

    /**
     * Output format: "print", "text" or "json".
     */
    @Parameter(property = "importsearch.outputFormat", defaultValue = "print")
    private String outputFormat;

    /**
     * Output file for the text and json formats. The format's suffix is applied.
     */
    @Parameter(property = "importsearch.outputFile",
            defaultValue = "${project.build.directory}/importsearch/output")
    private File outputFile;

    /**
     * Whether to log skipped files and written outputs.
     */
    @Parameter(property = "importsearch.verbose", defaultValue = "false")
    private boolean verbose;

    /**
     * Whether to skip execution.
     */
    @Parameter(property = "importsearch.skip", defaultValue = "false")
    private boolean skip;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Import search skipped");
            return;
        }

        logBanner();

        SearchConfiguration config = buildConfiguration();
        logConfigurationSummary(config);

        try {
            SearchResult result = new ImportSearch(config).run();
            logOutput(result);
            logResult(result);

        } catch (ConfigurationException e) {
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Plugin configuration is invalid: " + e.getMessage(), e);

        } catch (ImportParseException e) {
            logError("Source could not be parsed", e);
            throw new MojoFailureException("Import search failed: " + e.getMessage(), e);

        } catch (ImportSearchException e) {
            logError("Search failed", e);
            throw new MojoExecutionException("Import search failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the search configuration from Mojo parameters.
     */
    SearchConfiguration buildConfiguration() {
        return SearchConfiguration.builder()
                .entryFile(entryFile != null && !entryFile.trim().isEmpty() ? new File(entryFile).toPath() : null)
                .rootPath(rootPath != null ? rootPath.toPath() : null)
                .outputFormat(outputFormat)
                .outputFile(outputFile != null ? outputFile.toPath() : null)
                .verbose(verbose)
                .build();
    }

    private void logOutput(SearchResult result) {
        for (String line : result.getRenderedOutput().split("\n", -1)) {
            getLog().info(line);
        }
    }

    private void logResult(SearchResult result) {
        getLog().info("============================================================");
        getLog().info("Search Results:");
        getLog().info("  Files visited: " + result.getGraph().getVisited().size());
        getLog().info("  Files with imports: " + result.getGraph().getFileCount());
        getLog().info("  Dependencies: " + result.getGraph().getDependencyCount());
        getLog().info("  External modules: " + result.getGraph().getExternalDependencies().size());
        result.getOutputFile().ifPresent(file -> getLog().info("  Output written to: " + file));
        result.getWriteError().ifPresent(error -> getLog().warn("  Output not written: " + error));
        getLog().info("  Execution time: " + result.getExecutionTimeMs() + "ms");
        getLog().info("============================================================");
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Import Search Maven Plugin - Python Import Graph");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(SearchConfiguration config) {
        getLog().info("Configuration:");
        getLog().info("  Entry file: " + config.getEntryFile());
        getLog().info("  Root path: " + config.getRootPath());
        getLog().info("  Output format: " + config.getOutputFormat());
        if (!"print".equalsIgnoreCase(config.getOutputFormat())) {
            getLog().info("  Output file: " + config.getOutputFile());
        }
        getLog().info("  Verbose: " + config.isVerbose());
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Import Search Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }
}
