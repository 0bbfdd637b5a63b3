package org.example.importsearch.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Context an import is resolved in: the configured root and the file containing the import.
 */
public class ResolutionContext {

    private final Path rootPath;
    private final Path importingFile;

    public ResolutionContext(Path rootPath, Path importingFile) {
        this.rootPath = Objects.requireNonNull(rootPath, "rootPath cannot be null")
                .toAbsolutePath().normalize();
        this.importingFile = Objects.requireNonNull(importingFile, "importingFile cannot be null")
                .toAbsolutePath().normalize();
    }

    public Path getRootPath() {
        return rootPath;
    }

    public Path getImportingFile() {
        return importingFile;
    }

    /**
     * Returns the dotted module name of the importing file, e.g. {@code pkg.sub.mod}
     * for {@code pkg/sub/mod.py} and {@code pkg.sub} for {@code pkg/sub/__init__.py}.
     */
    public String moduleName() {
        return String.join(".", moduleParts());
    }

    /**
     * Returns the dotted package the importing file belongs to. For a package initializer
     * this is the package itself, otherwise the module name without its last segment.
     * Files outside the root have an empty package.
     */
    public String packageName() {
        if (!importingFile.startsWith(rootPath)) {
            return "";
        }
        List<String> parts = moduleParts();
        String fileName = importingFile.getFileName().toString();
        boolean initializer = fileName.equals(PathNames.PACKAGE_INITIALIZER + PathNames.SOURCE_SUFFIX);
        if (!initializer && !parts.isEmpty()) {
            parts = parts.subList(0, parts.size() - 1);
        }
        return String.join(".", parts);
    }

    private List<String> moduleParts() {
        Path relative = importingFile.startsWith(rootPath)
                ? rootPath.relativize(importingFile)
                : importingFile;
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        if (parts.isEmpty()) {
            return parts;
        }
        int last = parts.size() - 1;
        String fileName = parts.get(last);
        int dot = fileName.lastIndexOf('.');
        if (dot > 0) {
            parts.set(last, fileName.substring(0, dot));
        }
        if (parts.get(last).equals(PathNames.PACKAGE_INITIALIZER)) {
            parts.remove(last);
        }
        return parts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolutionContext that = (ResolutionContext) o;
        return rootPath.equals(that.rootPath) && importingFile.equals(that.importingFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootPath, importingFile);
    }

    @Override
    public String toString() {
        return "ResolutionContext{root=" + rootPath + ", file=" + importingFile + "}";
    }
}
