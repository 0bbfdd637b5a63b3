package org.example.importsearch.output;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported output formats.
 */
public enum OutputFormat {

    /** Console rendering, not written to disk. */
    PRINT("print", null),

    /** Human-readable text file. */
    TEXT("text", "txt"),

    /** JSON document with summary and visited files. */
    JSON("json", "json");

    private final String formatName;
    private final String fileSuffix;

    OutputFormat(String formatName, String fileSuffix) {
        this.formatName = formatName;
        this.fileSuffix = fileSuffix;
    }

    public String getFormatName() {
        return formatName;
    }

    /**
     * Returns the file suffix (without dot), or null if the format is not written to a file.
     */
    public String getFileSuffix() {
        return fileSuffix;
    }

    public boolean writesFile() {
        return fileSuffix != null;
    }

    /**
     * Looks up a format by name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OutputFormat fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.formatName.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name +
                ". use " + names() + " instead.");
    }

    /**
     * Returns true if the name denotes a supported format.
     */
    public static boolean isSupported(String name) {
        try {
            fromName(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static String names() {
        return Arrays.stream(values())
                .map(OutputFormat::getFormatName)
                .collect(Collectors.joining(", "));
    }
}
