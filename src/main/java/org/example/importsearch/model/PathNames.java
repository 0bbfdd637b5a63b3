package org.example.importsearch.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Naming conventions for Python source files and root-relative display paths.
 */
public final class PathNames {

    /** Suffix of Python source files. */
    public static final String SOURCE_SUFFIX = ".py";

    /** Module name of a package initializer file. */
    public static final String PACKAGE_INITIALIZER = "__init__";

    private PathNames() {
    }

    /**
     * Returns the path relative to the root with forward slashes.
     * Paths outside the root are returned as absolute forward-slash strings.
     */
    public static String relativize(Path path, Path root) {
        Path absolute = path.toAbsolutePath().normalize();
        if (root != null) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            if (absolute.startsWith(normalizedRoot)) {
                return toForwardSlashes(normalizedRoot.relativize(absolute));
            }
        }
        return toForwardSlashes(absolute);
    }

    /**
     * Returns the real path of an existing file, with symbolic links resolved, so that
     * a file reached through a linked directory has a single identity. Paths that do not
     * exist are only made absolute and normalized.
     *
     * @throws UncheckedIOException if an existing path cannot be resolved
     */
    public static Path canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve real path of " + absolute, e);
        }
    }

    /**
     * Returns true if the file name carries the Python source suffix.
     */
    public static boolean hasSourceSuffix(String name) {
        return name.endsWith(SOURCE_SUFFIX);
    }

    private static String toForwardSlashes(Path path) {
        return path.toString().replace('\\', '/');
    }
}
