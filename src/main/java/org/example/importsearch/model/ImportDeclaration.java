package org.example.importsearch.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single raw import declaration as written in a source file.
 *
 * <p>{@code import a.b as x} yields an {@link Kind#ABSOLUTE} declaration with module {@code a.b}.
 * {@code from ..pkg import name} yields a {@link Kind#FROM} declaration with level 2, module
 * {@code pkg} and imported name {@code name}. A star import carries {@code "*"} as imported name.</p>
 */
public class ImportDeclaration {

    /** Imported name of a star import. */
    public static final String STAR = "*";

    /**
     * Statement form of the declaration.
     */
    public enum Kind {
        ABSOLUTE,
        FROM
    }

    private final Kind kind;
    private final String module;
    private final int level;
    private final String importedName;
    private final int lineNumber;

    private ImportDeclaration(Kind kind, String module, int level, String importedName, int lineNumber) {
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0, but was: " + level);
        }
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.module = module == null || module.isEmpty() ? null : module;
        this.level = level;
        this.importedName = importedName;
        this.lineNumber = lineNumber;
    }

    /**
     * Creates a declaration for {@code import module}.
     */
    public static ImportDeclaration absolute(String module, int lineNumber) {
        Objects.requireNonNull(module, "module cannot be null");
        return new ImportDeclaration(Kind.ABSOLUTE, module, 0, null, lineNumber);
    }

    /**
     * Creates a declaration for {@code from <dots><module> import importedName}.
     *
     * @param module       dotted module name, null or empty for {@code from . import x}
     * @param level        number of leading dots
     * @param importedName imported name, {@link #STAR} for star imports
     */
    public static ImportDeclaration from(String module, int level, String importedName, int lineNumber) {
        Objects.requireNonNull(importedName, "importedName cannot be null");
        return new ImportDeclaration(Kind.FROM, module, level, importedName, lineNumber);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getModule() {
        return Optional.ofNullable(module);
    }

    public int getLevel() {
        return level;
    }

    public Optional<String> getImportedName() {
        return Optional.ofNullable(importedName);
    }

    public boolean isStar() {
        return STAR.equals(importedName);
    }

    public boolean isRelative() {
        return level > 0;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImportDeclaration that = (ImportDeclaration) o;
        return level == that.level &&
               kind == that.kind &&
               Objects.equals(module, that.module) &&
               Objects.equals(importedName, that.importedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, module, level, importedName);
    }

    @Override
    public String toString() {
        if (kind == Kind.ABSOLUTE) {
            return "import " + module;
        }
        return "from " + ".".repeat(level) + (module != null ? module : "") + " import " + importedName;
    }
}
