package org.example.importsearch.resolver;

import org.example.importsearch.exception.ImportParseException;
import org.example.importsearch.model.Dependency;
import org.example.importsearch.model.DependencyGraph;
import org.example.importsearch.model.ImportDeclaration;
import org.example.importsearch.model.PathNames;
import org.example.importsearch.model.ResolutionContext;
import org.example.importsearch.parser.ImportExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds the import graph of an entry file with a depth-first traversal.
 *
 * <p>Every file is processed at most once: the first time it is popped it is marked
 * visited, its imports are extracted and resolved, and the resolved targets are pushed
 * so that siblings are expanded in declaration order. A file reached again through a
 * cycle is skipped, which terminates the traversal on cyclic imports. External
 * dependencies are recorded but never followed.</p>
 *
 * <p>Files are identified by their real path, so a module reached through a
 * symbolically linked directory is visited once.</p>
 *
 * <p>An explicit stack is used instead of recursion, so deep import chains do not
 * exhaust the call stack.</p>
 */
public class ImportGraphBuilder implements DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportGraphBuilder.class);

    private final Path rootPath;
    private final ImportExtractor extractor;
    private final ModuleResolver moduleResolver;
    private final boolean verbose;

    public ImportGraphBuilder(Path rootPath, boolean verbose) {
        this(rootPath, new ImportExtractor(verbose), new ModuleResolver(rootPath), verbose);
    }

    public ImportGraphBuilder(Path rootPath,
                              ImportExtractor extractor,
                              ModuleResolver moduleResolver,
                              boolean verbose) {
        this.rootPath = PathNames.canonical(Objects.requireNonNull(rootPath, "rootPath cannot be null"));
        this.extractor = Objects.requireNonNull(extractor, "extractor cannot be null");
        this.moduleResolver = Objects.requireNonNull(moduleResolver, "moduleResolver cannot be null");
        this.verbose = verbose;
    }

    @Override
    public DependencyGraph resolve(Path entryFile) throws ImportParseException {
        Path start = PathNames.canonical(coerceEntryFile(entryFile));
        log.info("Searching imports from {} (root: {})", PathNames.relativize(start, rootPath), rootPath);

        DependencyGraph graph = new DependencyGraph(rootPath, start);
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            Path file = PathNames.canonical(stack.pop());

            if (graph.isVisited(file)) {
                log.debug("Skipping already visited: {}", file);
                continue;
            }
            if (!Files.isRegularFile(file)) {
                logMissing(file);
                continue;
            }

            graph.markVisited(file);
            List<Dependency> dependencies = resolveImports(file);
            graph.addDependencies(file, dependencies);

            List<Path> next = new ArrayList<>();
            for (Dependency dependency : dependencies) {
                dependency.getTarget().ifPresent(next::add);
            }

            // reversed so that the first declared import is expanded first
            Collections.reverse(next);
            for (Path target : next) {
                stack.push(target);
            }
        }

        log.info("Search completed: {} file(s) visited, {} file(s) with imports, {} dependencies",
                graph.getVisited().size(), graph.getFileCount(), graph.getDependencyCount());
        return graph;
    }

    /**
     * Extracts and resolves the imports of one file, in declaration order.
     */
    List<Dependency> resolveImports(Path file) throws ImportParseException {
        List<ImportDeclaration> declarations = extractor.extract(file);
        if (declarations.isEmpty()) {
            return List.of();
        }

        ResolutionContext context = new ResolutionContext(rootPath, file);
        List<Dependency> dependencies = new ArrayList<>(declarations.size());
        for (ImportDeclaration declaration : declarations) {
            Dependency dependency = moduleResolver.resolve(context, declaration);
            log.trace("{}: {} -> {}", file.getFileName(), declaration, dependency);
            dependencies.add(dependency);
        }
        return dependencies;
    }

    /**
     * Turns the user supplied entry into a source file path.
     *
     * <p>Relative paths are taken relative to the root. A package directory becomes its
     * initializer, and a missing {@code .py} suffix is appended.</p>
     */
    public Path coerceEntryFile(Path entryFile) {
        Objects.requireNonNull(entryFile, "entryFile cannot be null");
        Path path = entryFile.isAbsolute() ? entryFile : rootPath.resolve(entryFile);
        path = path.normalize();

        if (Files.isDirectory(path)) {
            Path initializer = path.resolve(PathNames.PACKAGE_INITIALIZER + PathNames.SOURCE_SUFFIX);
            if (Files.exists(initializer)) {
                return initializer;
            }
        }
        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        if (!PathNames.hasSourceSuffix(fileName)) {
            int dot = fileName.lastIndexOf('.');
            String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
            path = path.resolveSibling(stem + PathNames.SOURCE_SUFFIX);
        }
        return path;
    }

    public Path getRootPath() {
        return rootPath;
    }

    private void logMissing(Path file) {
        if (verbose) {
            log.info("Skipping missing file: {}", file);
        } else {
            log.debug("Skipping missing file: {}", file);
        }
    }
}
