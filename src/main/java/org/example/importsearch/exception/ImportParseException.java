package org.example.importsearch.exception;

/**
 * Exception thrown when a source file cannot be parsed into import declarations.
 * Parsing failures abort the whole search.
 */
public class ImportParseException extends ImportSearchException {

    private final String fileName;
    private final int lineNumber;

    public ImportParseException(String fileName, int lineNumber, String message) {
        super(fileName + ":" + lineNumber + ": " + message);
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public ImportParseException(String fileName, String message, Throwable cause) {
        super(fileName + ": " + message, cause);
        this.fileName = fileName;
        this.lineNumber = -1;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Returns the 1-based line of the offending statement, or -1 when unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
