package org.example.formula.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration model.
 */
public class ResolverConfiguration {

    /**
     * Maximum number of candidate and branch choices the search may make.
     * -1 = unlimited.
     * Default: -1
     */
    private long maxSteps = -1;

    /**
     * Include filter patterns (glob style) on package names.
     */
    private List<String> includeFilters = new ArrayList<>();

    /**
     * Exclude filter patterns (glob style) on package names.
     */
    private List<String> excludeFilters = new ArrayList<>();

    /**
     * Whether an invalid metadata entry fails the whole load.
     * Default: false (the entry is skipped and reported)
     */
    private boolean failOnInvalidMetadata = false;

    public ResolverConfiguration() {
    }

    public static ResolverConfiguration defaults() {
        return new ResolverConfiguration();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters and Setters

    public long getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(long maxSteps) {
        this.maxSteps = maxSteps;
    }

    public boolean isStepLimited() {
        return maxSteps >= 0;
    }

    public List<String> getIncludeFilters() {
        return includeFilters;
    }

    public void setIncludeFilters(List<String> includeFilters) {
        this.includeFilters = includeFilters != null ? includeFilters : new ArrayList<>();
    }

    public List<String> getExcludeFilters() {
        return excludeFilters;
    }

    public void setExcludeFilters(List<String> excludeFilters) {
        this.excludeFilters = excludeFilters != null ? excludeFilters : new ArrayList<>();
    }

    public boolean isFailOnInvalidMetadata() {
        return failOnInvalidMetadata;
    }

    public void setFailOnInvalidMetadata(boolean failOnInvalidMetadata) {
        this.failOnInvalidMetadata = failOnInvalidMetadata;
    }

    @Override
    public String toString() {
        return "ResolverConfiguration{" +
                "maxSteps=" + (maxSteps == -1 ? "unlimited" : maxSteps) +
                ", includeFilters=" + includeFilters +
                ", excludeFilters=" + excludeFilters +
                ", failOnInvalidMetadata=" + failOnInvalidMetadata +
                '}';
    }

    /**
     * Builder for ResolverConfiguration.
     */
    public static class Builder {
        private final ResolverConfiguration config = new ResolverConfiguration();

        public Builder maxSteps(long maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        public Builder includeFilters(List<String> includeFilters) {
            config.setIncludeFilters(includeFilters);
            return this;
        }

        public Builder excludeFilters(List<String> excludeFilters) {
            config.setExcludeFilters(excludeFilters);
            return this;
        }

        public Builder failOnInvalidMetadata(boolean failOnInvalidMetadata) {
            config.setFailOnInvalidMetadata(failOnInvalidMetadata);
            return this;
        }

        public ResolverConfiguration build() {
            return config;
        }
    }
}
