package org.example.importsearch.output;

import org.example.importsearch.model.DependencyGraph;
import org.example.importsearch.tree.SummaryNormalizer;
import org.example.importsearch.tree.TreeRenderer;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a finished search, as consumed by the formatters.
 */
public class SearchReport {

    private final String entryName;
    private final Map<String, List<String>> summary;
    private final List<String> visited;
    private final List<String> tree;

    public SearchReport(String entryName, Map<String, List<String>> summary,
                        List<String> visited, List<String> tree) {
        this.entryName = Objects.requireNonNull(entryName, "entryName cannot be null");
        this.summary = Collections.unmodifiableMap(Objects.requireNonNull(summary, "summary cannot be null"));
        this.visited = List.copyOf(visited);
        this.tree = List.copyOf(tree);
    }

    /**
     * Builds the report of a dependency graph: normalized summary, sorted visited
     * files and the tree rendered from the entry file.
     */
    public static SearchReport from(DependencyGraph graph) {
        Map<String, List<String>> summary = SummaryNormalizer.normalize(graph.toSummary());
        String entryName = graph.getEntryName();
        return new SearchReport(entryName, summary, graph.getSortedVisited(),
                TreeRenderer.render(summary, entryName));
    }

    public String getEntryName() {
        return entryName;
    }

    /**
     * Root-relative file path to dependency display names, in discovery order.
     */
    public Map<String, List<String>> getSummary() {
        return summary;
    }

    /**
     * Sorted root-relative paths of all visited files.
     */
    public List<String> getVisited() {
        return visited;
    }

    public List<String> getTree() {
        return tree;
    }

    @Override
    public String toString() {
        return "SearchReport{entry=" + entryName +
                ", files=" + summary.size() +
                ", visited=" + visited.size() + "}";
    }
}
