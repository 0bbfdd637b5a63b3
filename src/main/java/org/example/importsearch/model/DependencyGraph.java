package org.example.importsearch.model;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Represents the import graph discovered from one entry file.
 * Maps each visited file (node) to its ordered dependencies (edges).
 *
 * <p>Files without any dependency are tracked in the visited set only; they are
 * never added as keys of the dependency map.</p>
 */
public class DependencyGraph {

    private final Path rootPath;
    private final Path entryFile;
    private final Map<Path, List<Dependency>> dependencies;
    private final Set<Path> visited;

    /**
     * Creates a new, empty DependencyGraph.
     *
     * @param rootPath  the root directory imports were resolved against
     * @param entryFile the file the search started from
     */
    public DependencyGraph(Path rootPath, Path entryFile) {
        this.rootPath = Objects.requireNonNull(rootPath, "rootPath cannot be null")
                .toAbsolutePath().normalize();
        this.entryFile = Objects.requireNonNull(entryFile, "entryFile cannot be null")
                .toAbsolutePath().normalize();
        this.dependencies = new LinkedHashMap<>();
        this.visited = new LinkedHashSet<>();
    }

    // Getters

    public Path getRootPath() {
        return rootPath;
    }

    public Path getEntryFile() {
        return entryFile;
    }

    public Map<Path, List<Dependency>> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    public Set<Path> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    // Modification methods

    /**
     * Marks a file as visited.
     *
     * @return true if the file had not been visited before
     */
    public boolean markVisited(Path file) {
        return visited.add(normalize(file));
    }

    /**
     * Records the dependencies of a file. Empty lists are ignored.
     */
    public void addDependencies(Path file, List<Dependency> fileDependencies) {
        if (fileDependencies == null || fileDependencies.isEmpty()) {
            return;
        }
        dependencies.put(normalize(file), List.copyOf(fileDependencies));
    }

    // Query methods

    public boolean isVisited(Path file) {
        return visited.contains(normalize(file));
    }

    /**
     * Returns the dependencies recorded for a file, empty if none.
     */
    public List<Dependency> getDependenciesOf(Path file) {
        return dependencies.getOrDefault(normalize(file), List.of());
    }

    /**
     * Returns the number of files with recorded dependencies.
     */
    public int getFileCount() {
        return dependencies.size();
    }

    /**
     * Returns the number of recorded dependency edges.
     */
    public int getDependencyCount() {
        return dependencies.values().stream()
                .mapToInt(List::size)
                .sum();
    }

    /**
     * Returns all dependencies that could not be resolved to a local file.
     */
    public List<Dependency> getExternalDependencies() {
        return dependencies.values().stream()
                .flatMap(List::stream)
                .filter(d -> !d.isResolved())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * Returns the flat summary: root-relative file path to dependency display names,
     * in discovery order.
     */
    public Map<String, List<String>> toSummary() {
        Map<String, List<String>> summary = new LinkedHashMap<>();
        for (Map.Entry<Path, List<Dependency>> entry : dependencies.entrySet()) {
            summary.put(PathNames.relativize(entry.getKey(), rootPath),
                    entry.getValue().stream()
                            .map(Dependency::getName)
                            .collect(Collectors.toList()));
        }
        return summary;
    }

    /**
     * Returns the visited files as sorted root-relative paths.
     */
    public List<String> getSortedVisited() {
        return visited.stream()
                .map(p -> PathNames.relativize(p, rootPath))
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Returns the root-relative name of the entry file.
     */
    public String getEntryName() {
        return PathNames.relativize(entryFile, rootPath);
    }

    private Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "entryFile=" + getEntryName() +
                ", visitedCount=" + visited.size() +
                ", fileCount=" + dependencies.size() +
                ", dependencyCount=" + getDependencyCount() +
                '}';
    }

    /**
     * Returns a detailed string representation of the graph.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DependencyGraph:\n");
        sb.append("  Root: ").append(rootPath).append("\n");
        sb.append("  Entry: ").append(getEntryName()).append("\n");
        sb.append("  Files (").append(dependencies.size()).append("):\n");
        for (Map.Entry<String, List<String>> entry : toSummary().entrySet()) {
            sb.append("    - ").append(entry.getKey()).append(" -> ").append(entry.getValue()).append("\n");
        }
        sb.append("  Visited (").append(visited.size()).append("):\n");
        for (String file : getSortedVisited()) {
            sb.append("    - ").append(file).append("\n");
        }
        return sb.toString();
    }
}
