package org.example.importsearch.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved outcome of one import reference.
 * This is an edge in the dependency graph.
 *
 * <p>A dependency is either {@link Resolved}, pointing at a concrete file under
 * the root directory, or {@link External}, carrying only the best-effort name of
 * a module that does not live under the root (standard library, third party).</p>
 */
public abstract class Dependency {

    private final String name;

    private Dependency(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * Creates a dependency on a local file.
     *
     * @param file the file the import resolved to
     * @param root the root directory, used to derive the display name
     */
    public static Dependency resolved(Path file, Path root) {
        Objects.requireNonNull(file, "file cannot be null");
        Path absolute = file.toAbsolutePath().normalize();
        return new Resolved(absolute, PathNames.relativize(absolute, root));
    }

    /**
     * Creates an unresolved dependency known by name only.
     */
    public static Dependency external(String name) {
        return new External(name);
    }

    /**
     * Display name: root-relative path for resolved files, dotted module name otherwise.
     */
    public String getName() {
        return name;
    }

    public abstract boolean isResolved();

    /**
     * Returns the local file this dependency points at, if any.
     */
    public abstract Optional<Path> getTarget();

    /**
     * Dependency on a file under the root directory.
     */
    public static final class Resolved extends Dependency {

        private final Path path;

        private Resolved(Path path, String name) {
            super(name);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public Optional<Path> getTarget() {
            return Optional.of(path);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Resolved that = (Resolved) o;
            return path.equals(that.path) && getName().equals(that.getName());
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, getName());
        }

        @Override
        public String toString() {
            return "Resolved{" + getName() + " -> " + path + "}";
        }
    }

    /**
     * Dependency that does not correspond to any file under the root.
     */
    public static final class External extends Dependency {

        private External(String name) {
            super(name);
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public Optional<Path> getTarget() {
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return getName().equals(((External) o).getName());
        }

        @Override
        public int hashCode() {
            return getName().hashCode();
        }

        @Override
        public String toString() {
            return "External{" + getName() + "}";
        }
    }
}
