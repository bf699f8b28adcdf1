package org.kidoni.randomvars;

/**
 * Limits applied while sampling.
 *
 * @param maxRejections how many rejected draws a conditional value may go through before sampling fails
 */
public record SamplingSettings(int maxRejections) {
    public static final int DEFAULT_MAX_REJECTIONS = 1_000_000;
    public static final String MAX_REJECTIONS_PROPERTY = "randomvars.maxRejections";
    public static final String MAX_REJECTIONS_ENV = "RANDOMVARS_MAX_REJECTIONS";

    public SamplingSettings {
        if (maxRejections < 1) {
            throw new IllegalArgumentException("maxRejections must be greater than 0");
        }
    }

    public static SamplingSettings defaults() {
        return new SamplingSettings(DEFAULT_MAX_REJECTIONS);
    }

    /**
     * Reads the {@value #MAX_REJECTIONS_PROPERTY} system property, falling back to the
     * {@value #MAX_REJECTIONS_ENV} environment variable and then to the defaults.
     */
    public static SamplingSettings fromEnvironment() {
        return resolve(System.getProperty(MAX_REJECTIONS_PROPERTY), System.getenv(MAX_REJECTIONS_ENV));
    }

    static SamplingSettings resolve(final String property, final String env) {
        final String value = property != null && !property.isBlank() ? property : env;
        if (value == null || value.isBlank()) {
            return defaults();
        }

        try {
            return new SamplingSettings(Integer.parseInt(value.trim()));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid maximum rejection count: " + value, e);
        }
    }

    public SamplingSettings withMaxRejections(final int maxRejections) {
        return new SamplingSettings(maxRejections);
    }
}
