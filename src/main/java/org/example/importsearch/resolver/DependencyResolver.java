package org.example.importsearch.resolver;

import org.example.importsearch.exception.ImportSearchException;
import org.example.importsearch.model.DependencyGraph;

import java.nio.file.Path;

/**
 * Interface for dependency resolvers.
 */
public interface DependencyResolver {

    /**
     * Resolves the dependency graph reachable from an entry file.
     *
     * @param entryFile the file to start from, absolute or relative to the root
     * @return a new dependency graph
     * @throws ImportSearchException if a reachable file cannot be parsed
     */
    DependencyGraph resolve(Path entryFile) throws ImportSearchException;
}
