package org.example.importsearch.output;

import org.example.importsearch.exception.OutputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes formatted search output to a file.
 *
 * <p>The target file is the configured output path with its suffix replaced by the
 * format's suffix, so {@code build/output} becomes {@code build/output.json}.
 * Missing parent directories are created.</p>
 */
public class SummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(SummaryWriter.class);

    private final boolean verbose;

    public SummaryWriter(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Writes the content.
     *
     * @param content    formatted output
     * @param outputPath configured output path
     * @param format     format the content was produced in, must write files
     * @return the file written
     * @throws OutputException if the file cannot be written
     */
    public Path write(String content, Path outputPath, OutputFormat format) throws OutputException {
        Objects.requireNonNull(outputPath, "outputPath cannot be null");
        if (!format.writesFile()) {
            throw new IllegalArgumentException("Format does not write files: " + format.getFormatName());
        }

        Path outputFile = withSuffix(outputPath, format.getFileSuffix());
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputException("Error writing to " + outputFile + ": " + e.getMessage(), e);
        }

        if (verbose) {
            log.info("Summary written to {}", outputFile);
        } else {
            log.debug("Summary written to {}", outputFile);
        }
        return outputFile;
    }

    /**
     * Replaces the suffix of the file name, or appends one if it has none.
     */
    static Path withSuffix(Path path, String suffix) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(stem + "." + suffix);
    }
}
