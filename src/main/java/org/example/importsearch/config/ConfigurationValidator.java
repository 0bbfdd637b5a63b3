package org.example.importsearch.config;

import org.example.importsearch.exception.ConfigurationException;
import org.example.importsearch.output.OutputFormat;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates search configuration parameters.
 * Throws ConfigurationException if validation fails.
 */
public class ConfigurationValidator {

    /**
     * Validates the search configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(SearchConfiguration config) {
        List<String> errors = new ArrayList<>();

        // Required field validation
        validateRequired(config, errors);

        // Value validation
        validateValues(config, errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(SearchConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid search configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateRequired(SearchConfiguration config, List<String> errors) {
        if (config.getEntryFile() == null || isBlank(config.getEntryFile().toString())) {
            errors.add("entryFile is required");
        }

        if (config.getRootPath() == null) {
            errors.add("rootPath is required");
        }

        if (isBlank(config.getOutputFormat())) {
            errors.add("outputFormat is required");
        }
    }

    private void validateValues(SearchConfiguration config, List<String> errors) {
        // Root path must be an existing directory
        if (config.getRootPath() != null && !Files.isDirectory(config.getRootPath())) {
            errors.add("rootPath must be an existing directory, but was: " + config.getRootPath());
        }

        // Output format validation
        if (!isBlank(config.getOutputFormat())) {
            if (!OutputFormat.isSupported(config.getOutputFormat())) {
                errors.add("Unknown output format: " + config.getOutputFormat() +
                           ". Must be one of: " + OutputFormat.names());
            } else if (OutputFormat.fromName(config.getOutputFormat()).writesFile()
                    && config.getOutputFile() == null) {
                errors.add("outputFile is required for output format " + config.getOutputFormat());
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
