package org.example.importsearch;

import org.example.importsearch.config.ConfigurationValidator;
import org.example.importsearch.config.SearchConfiguration;
import org.example.importsearch.exception.ImportSearchException;
import org.example.importsearch.exception.OutputException;
import org.example.importsearch.model.DependencyGraph;
import org.example.importsearch.output.OutputFormat;
import org.example.importsearch.output.SearchReport;
import org.example.importsearch.output.SummaryFormatter;
import org.example.importsearch.output.SummaryWriter;
import org.example.importsearch.parser.ImportExtractor;
import org.example.importsearch.resolver.DependencyResolver;
import org.example.importsearch.resolver.ImportGraphBuilder;
import org.example.importsearch.resolver.ModuleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Runs one import search: validates the configuration, builds the dependency graph,
 * formats the report and writes it out.
 *
 * <p>Configuration and parse errors abort the run. A failure to write the output is
 * logged and recorded in the {@link SearchResult}, the run itself still succeeds.</p>
 */
public class ImportSearch {

    private static final Logger log = LoggerFactory.getLogger(ImportSearch.class);

    private final SearchConfiguration config;
    private final SummaryWriter writer;

    public ImportSearch(SearchConfiguration config) {
        this(config, new SummaryWriter(config.isVerbose()));
    }

    ImportSearch(SearchConfiguration config, SummaryWriter writer) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
    }

    /**
     * Executes the search.
     *
     * @return the search result
     * @throws ImportSearchException if the configuration is invalid or a file cannot be parsed
     */
    public SearchResult run() throws ImportSearchException {
        new ConfigurationValidator().validateOrThrow(config);
        OutputFormat format = OutputFormat.fromName(config.getOutputFormat());
        long start = System.currentTimeMillis();

        Path rootPath = config.getRootPath().toAbsolutePath().normalize();
        DependencyResolver resolver = createResolver(rootPath);
        DependencyGraph graph = resolver.resolve(config.getEntryFile());

        SearchReport report = SearchReport.from(graph);
        String content = SummaryFormatter.forFormat(format).format(report);

        SearchResult.Builder result = SearchResult.builder()
                .graph(graph)
                .report(report)
                .renderedOutput(content);

        if (format.writesFile()) {
            try {
                result.outputFile(writer.write(content, config.getOutputFile(), format));
            } catch (OutputException e) {
                log.error(e.getMessage());
                log.debug("Write failure", e);
                result.writeError(e.getMessage());
            }
        }

        return result
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();
    }

    private DependencyResolver createResolver(Path rootPath) {
        return new ImportGraphBuilder(
                rootPath,
                new ImportExtractor(config.isVerbose()),
                new ModuleResolver(rootPath),
                config.isVerbose()
        );
    }

    public SearchConfiguration getConfig() {
        return config;
    }
}
