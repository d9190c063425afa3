package org.example.formula.config;

import org.example.formula.exception.ConfigurationException;
import org.example.formula.filter.PatternMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates engine configuration.
 */
public class ConfigurationValidator {

    /**
     * Validates the configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(ResolverConfiguration config) {
        List<String> errors = new ArrayList<>();

        if (config == null) {
            errors.add("configuration is required");
            return errors;
        }

        if (config.getMaxSteps() < -1) {
            errors.add("maxSteps must be -1 (unlimited) or >= 0, but was: " + config.getMaxSteps());
        }

        validateFilters(config.getIncludeFilters(), "includeFilters", errors);
        validateFilters(config.getExcludeFilters(), "excludeFilters", errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(ResolverConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid engine configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateFilters(List<String> filters, String filterName, List<String> errors) {
        if (filters == null) return;

        for (String filter : filters) {
            if (isBlank(filter)) {
                errors.add(filterName + " contains empty filter");
            } else {
                PatternMatcher.problemWith(filter)
                        .ifPresent(problem -> errors.add(filterName + " contains invalid pattern: "
                                + filter.trim() + " (" + problem + ")"));
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
