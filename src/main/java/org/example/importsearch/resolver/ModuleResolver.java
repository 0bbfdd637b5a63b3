package org.example.importsearch.resolver;

import org.example.importsearch.model.Dependency;
import org.example.importsearch.model.ImportDeclaration;
import org.example.importsearch.model.PathNames;
import org.example.importsearch.model.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps import declarations to files under a root directory.
 *
 * <p>A dotted module name {@code a.b.c} resolves to {@code <root>/a/b/c.py} if that
 * file exists, otherwise to the package initializer {@code <root>/a/b/c/__init__.py}.
 * Names that match neither are returned as {@link Dependency#external(String) external}
 * dependencies: standard library and third-party modules end up there.</p>
 *
 * <p>Relative imports are resolved against the package of the importing file, which is
 * supplied through a {@link ResolutionContext}. For {@code from x import name} the
 * resolver first tries {@code x.name} as a submodule and falls back to {@code x} itself,
 * treating {@code name} as an attribute of that module.</p>
 */
public class ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(ModuleResolver.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final Path rootPath;

    public ModuleResolver(Path rootPath) {
        this.rootPath = PathNames.canonical(Objects.requireNonNull(rootPath, "rootPath cannot be null"));
    }

    public Path getRootPath() {
        return rootPath;
    }

    /**
     * Resolves one declaration in the given context.
     */
    public Dependency resolve(ResolutionContext context, ImportDeclaration declaration) {
        if (declaration.getKind() == ImportDeclaration.Kind.ABSOLUTE) {
            return resolveAbsolute(declaration.getModule().orElse(""));
        }
        String importedName = declaration.isStar() ? null : declaration.getImportedName().orElse(null);
        return resolveFrom(context, declaration.getModule().orElse(null), declaration.getLevel(), importedName);
    }

    /**
     * Resolves an absolute dotted module name.
     *
     * @param moduleName dotted name such as {@code pkg.sub.mod}
     * @return a resolved dependency if the module maps to a file, external otherwise
     */
    public Dependency resolveAbsolute(String moduleName) {
        return findModuleFile(moduleName)
                .map(file -> Dependency.resolved(file, rootPath))
                .orElseGet(() -> Dependency.external(moduleName));
    }

    /**
     * Resolves a {@code from <dots><module> import <importedName>} declaration.
     *
     * @param context      the importing file and root
     * @param module       dotted module name, null or empty for {@code from . import x}
     * @param level        number of leading dots
     * @param importedName imported name, null or {@code "*"} for star imports
     * @return the first candidate that maps to a file, or an external dependency
     */
    public Dependency resolveFrom(ResolutionContext context, String module, int level, String importedName) {
        String packageName = context.packageName();
        List<String> candidates = buildCandidates(module, level, importedName);

        for (String candidate : candidates) {
            Optional<String> absoluteName = resolveRelativeName(candidate, packageName);
            if (absoluteName.isEmpty()) {
                log.debug("Cannot resolve '{}' relative to package '{}'", candidate, packageName);
                continue;
            }
            Optional<Path> file = findModuleFile(absoluteName.get());
            if (file.isPresent()) {
                return Dependency.resolved(file.get(), rootPath);
            }
        }

        return Dependency.external(unresolvedName(candidates, packageName, module, importedName));
    }

    /**
     * Converts a possibly relative dotted name into an absolute one.
     *
     * <p>One leading dot designates {@code packageName} itself, every further dot moves
     * one package up. Fails when the name climbs above the top-level package or when a
     * relative name is used outside any package.</p>
     *
     * @param name        dotted name, possibly with leading dots
     * @param packageName package of the importing file
     * @return the absolute dotted name, empty if it cannot be computed
     */
    public Optional<String> resolveRelativeName(String name, String packageName) {
        String candidate = name == null ? "" : name.strip();
        if (candidate.isEmpty()) {
            return packageName == null || packageName.isEmpty() ? Optional.empty() : Optional.of(packageName);
        }
        if (!candidate.startsWith(".")) {
            return Optional.of(candidate);
        }
        if (packageName == null || packageName.isEmpty()) {
            return Optional.empty();
        }

        int level = 0;
        while (level < candidate.length() && candidate.charAt(level) == '.') {
            level++;
        }
        String remainder = candidate.substring(level);

        List<String> packageParts = new ArrayList<>(Arrays.asList(packageName.split("\\.")));
        int up = level - 1;
        if (up >= packageParts.size()) {
            return Optional.empty();
        }
        List<String> base = packageParts.subList(0, packageParts.size() - up);
        String baseName = String.join(".", base);
        return Optional.of(remainder.isEmpty() ? baseName : baseName + "." + remainder);
    }

    /**
     * Returns the dotted module name of a file under the root.
     */
    public String moduleName(Path file) {
        return new ResolutionContext(rootPath, file).moduleName();
    }

    /**
     * Builds the ordered list of dotted names to try for a from-import.
     */
    List<String> buildCandidates(String module, int level, String importedName) {
        String leading = ".".repeat(Math.max(level, 0));
        String base = module == null ? "" : module;
        List<String> candidates = new ArrayList<>();

        if (importedName == null || importedName.equals(ImportDeclaration.STAR)) {
            candidates.add(base.isEmpty() ? (leading.isEmpty() ? "." : leading) : leading + base);
        } else {
            String qualified = base.isEmpty() ? importedName : base + "." + importedName;
            candidates.add(leading + qualified);
            if (!base.isEmpty()) {
                candidates.add(leading + base);
            }
        }
        return candidates;
    }

    private String unresolvedName(List<String> candidates, String packageName,
                                  String module, String importedName) {
        String fallback = candidates.isEmpty() ? "" : candidates.get(candidates.size() - 1);
        String display = stripLeadingDots(fallback);
        if (display.isEmpty()) {
            display = packageName;
        }
        if (display == null || display.isEmpty()) {
            display = importedName;
        }
        if (display == null || display.isEmpty()) {
            display = module;
        }
        return display == null ? "" : display;
    }

    private Optional<Path> findModuleFile(String moduleName) {
        if (moduleName == null || moduleName.isEmpty()) {
            return Optional.empty();
        }
        String[] segments = moduleName.split("\\.", -1);
        for (String segment : segments) {
            if (!IDENTIFIER.matcher(segment).matches()) {
                return Optional.empty();
            }
        }

        Path modulePath = rootPath;
        for (int i = 0; i < segments.length - 1; i++) {
            modulePath = modulePath.resolve(segments[i]);
        }
        String last = segments[segments.length - 1];

        Path sourceFile = modulePath.resolve(last + PathNames.SOURCE_SUFFIX);
        if (Files.isRegularFile(sourceFile)) {
            return Optional.of(PathNames.canonical(sourceFile));
        }
        Path packageInitializer = modulePath.resolve(last)
                .resolve(PathNames.PACKAGE_INITIALIZER + PathNames.SOURCE_SUFFIX);
        if (Files.isRegularFile(packageInitializer)) {
            return Optional.of(PathNames.canonical(packageInitializer));
        }
        return Optional.empty();
    }

    private static String stripLeadingDots(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '.') {
            i++;
        }
        return name.substring(i);
    }
}
