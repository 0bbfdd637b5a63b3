package org.example.importsearch.parser;

import org.example.importsearch.exception.ImportParseException;
import org.example.importsearch.model.ImportDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Extracts the import declarations of a Python source file.
 *
 * <p>The whole file is parsed with the tree-sitter Python grammar. Any syntax error
 * in the file raises {@link ImportParseException}, not only errors inside import
 * statements. The Python 2 {@code print} and {@code exec} statements, which the grammar
 * still accepts, are rejected as well.</p>
 *
 * <p>Import statements are collected from the whole tree in source order, including
 * those nested in function bodies, conditionals and {@code match} cases.</p>
 */
public class ImportExtractor {

    private static final Logger log = LoggerFactory.getLogger(ImportExtractor.class);

    private static final String IMPORT_STATEMENT = "import_statement";
    private static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    private static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    private static final String FUTURE_MODULE = "__future__";

    private static final String ERROR_NODE = "ERROR";

    /**
     * Python 2 statements kept by the grammar for compatibility.
     */
    private static final Set<String> LEGACY_STATEMENTS = Set.of("print_statement", "exec_statement");

    private final boolean verbose;

    public ImportExtractor() {
        this(false);
    }

    /**
     * @param verbose whether skipped files are reported at INFO instead of DEBUG
     */
    public ImportExtractor(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Reads and parses a source file.
     *
     * @param file the file to parse
     * @return the declarations in source order, empty if the file does not exist
     * @throws ImportParseException if the file cannot be read or parsed
     */
    public List<ImportDeclaration> extract(Path file) throws ImportParseException {
        if (!Files.isRegularFile(file)) {
            logMissing(file);
            return List.of();
        }

        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            logMissing(file);
            return List.of();
        } catch (IOException e) {
            throw new ImportParseException(file.toString(), "Failed to read source: " + e.getMessage(), e);
        }

        List<ImportDeclaration> declarations = extract(source, file.toString());
        log.debug("Extracted {} import declaration(s) from {}", declarations.size(), file);
        return declarations;
    }

    /**
     * Parses source text.
     *
     * @param source   the Python source
     * @param fileName name used in error messages
     * @return the declarations in source order
     * @throws ImportParseException if the source is not valid Python
     */
    public List<ImportDeclaration> extract(String source, String fileName) throws ImportParseException {
        String text = stripByteOrderMark(source);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);

        // TSParser is not thread safe, one per call
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("Failed to load the tree-sitter Python grammar");
        }
        TSTree tree = parser.parseString(null, text);
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new ImportParseException(fileName, 1, "Parser produced no syntax tree");
        }

        List<ImportDeclaration> declarations = new ArrayList<>();
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            checkSyntax(node, bytes, fileName);

            String type = node.getType();
            if (IMPORT_STATEMENT.equals(type)) {
                readImport(node, bytes, fileName, declarations);
            } else if (IMPORT_FROM_STATEMENT.equals(type)) {
                readFromImport(node, bytes, fileName, declarations);
            } else if (FUTURE_IMPORT_STATEMENT.equals(type)) {
                readFutureImport(node, bytes, fileName, declarations);
            }

            // children are still walked so that errors inside statements are reported
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return declarations;
    }

    // ========== Syntax checks ==========

    private void checkSyntax(TSNode node, byte[] source, String fileName) throws ImportParseException {
        if (node.isMissing()) {
            throw new ImportParseException(fileName, lineOf(node),
                    "Invalid syntax: missing '" + node.getType() + "'");
        }
        if (ERROR_NODE.equals(node.getType())) {
            throw new ImportParseException(fileName, lineOf(node),
                    "Invalid syntax near '" + firstLine(text(node, source)) + "'");
        }
        if (LEGACY_STATEMENTS.contains(node.getType())) {
            throw new ImportParseException(fileName, lineOf(node),
                    "Python 2 statement is not valid syntax: '" + firstLine(text(node, source)) + "'");
        }
    }

    // ========== Statement reading ==========

    /**
     * Reads {@code import a.b as c, d}: one declaration per module.
     */
    private void readImport(TSNode statement, byte[] source, String fileName,
                            List<ImportDeclaration> declarations) throws ImportParseException {
        int line = lineOf(statement);
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode child = statement.getNamedChild(i);
            TSNode name = importedNameNode(child);
            if (name != null) {
                declarations.add(ImportDeclaration.absolute(dottedName(name, source, fileName), line));
            }
        }
    }

    /**
     * Reads {@code from <dots><module> import a, b as c} or {@code from <dots><module> import *}.
     */
    private void readFromImport(TSNode statement, byte[] source, String fileName,
                                List<ImportDeclaration> declarations) throws ImportParseException {
        int line = lineOf(statement);
        TSNode moduleNode = statement.getChildByFieldName("module_name");
        if (moduleNode == null || moduleNode.isNull()) {
            throw new ImportParseException(fileName, line, "Expected module name after 'from'");
        }

        String module = null;
        int level = 0;
        if ("relative_import".equals(moduleNode.getType())) {
            for (int i = 0; i < moduleNode.getNamedChildCount(); i++) {
                TSNode part = moduleNode.getNamedChild(i);
                if ("import_prefix".equals(part.getType())) {
                    level = countDots(text(part, source));
                } else if ("dotted_name".equals(part.getType())) {
                    module = dottedName(part, source, fileName);
                }
            }
        } else {
            module = dottedName(moduleNode, source, fileName);
        }

        readImportedNames(statement, moduleNode, module, level, source, fileName, declarations);
    }

    /**
     * Reads {@code from __future__ import feature}.
     */
    private void readFutureImport(TSNode statement, byte[] source, String fileName,
                                  List<ImportDeclaration> declarations) throws ImportParseException {
        readImportedNames(statement, null, FUTURE_MODULE, 0, source, fileName, declarations);
    }

    private void readImportedNames(TSNode statement, TSNode moduleNode, String module, int level,
                                   byte[] source, String fileName,
                                   List<ImportDeclaration> declarations) throws ImportParseException {
        int line = lineOf(statement);
        int added = 0;
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode child = statement.getNamedChild(i);
            if (moduleNode != null && child.getStartByte() == moduleNode.getStartByte()) {
                continue;
            }
            if ("wildcard_import".equals(child.getType())) {
                declarations.add(ImportDeclaration.from(module, level, ImportDeclaration.STAR, line));
                added++;
                continue;
            }
            TSNode name = importedNameNode(child);
            if (name == null) {
                continue;
            }
            String importedName = dottedName(name, source, fileName);
            if (importedName.contains(".")) {
                throw new ImportParseException(fileName, line, "Invalid imported name: '" + importedName + "'");
            }
            declarations.add(ImportDeclaration.from(module, level, importedName, line));
            added++;
        }
        if (added == 0) {
            throw new ImportParseException(fileName, line, "Expected names to import");
        }
    }

    /**
     * Returns the dotted name of an import list entry, unwrapping {@code x as y}.
     * Comments and other entries yield null.
     */
    private TSNode importedNameNode(TSNode child) {
        if ("dotted_name".equals(child.getType())) {
            return child;
        }
        if ("aliased_import".equals(child.getType())) {
            TSNode name = child.getChildByFieldName("name");
            return name == null || name.isNull() ? null : name;
        }
        return null;
    }

    /**
     * Joins the identifiers of a {@code dotted_name}, so {@code a . b} reads as {@code a.b}.
     */
    private String dottedName(TSNode node, byte[] source, String fileName) throws ImportParseException {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode part = node.getNamedChild(i);
            if ("identifier".equals(part.getType())) {
                parts.add(text(part, source));
            }
        }
        if (parts.isEmpty()) {
            throw new ImportParseException(fileName, lineOf(node),
                    "Invalid module name: '" + text(node, source) + "'");
        }
        return String.join(".", parts);
    }

    // ========== Helpers ==========

    private static int lineOf(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Node positions are UTF-8 byte offsets.
     */
    private static String text(TSNode node, byte[] source) {
        int start = Math.min(node.getStartByte(), source.length);
        int end = Math.min(Math.max(node.getEndByte(), start), source.length);
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    private static String firstLine(String text) {
        String stripped = text.strip();
        int newline = stripped.indexOf('\n');
        return newline < 0 ? stripped : stripped.substring(0, newline).strip();
    }

    private static int countDots(String prefix) {
        int dots = 0;
        for (int i = 0; i < prefix.length(); i++) {
            if (prefix.charAt(i) == '.') {
                dots++;
            }
        }
        return dots;
    }

    private static String stripByteOrderMark(String source) {
        return !source.isEmpty() && source.charAt(0) == '\uFEFF' ? source.substring(1) : source;
    }

    private void logMissing(Path file) {
        if (verbose) {
            log.info("Skipping missing file: {}", file);
        } else {
            log.debug("Skipping missing file: {}", file);
        }
    }
}
