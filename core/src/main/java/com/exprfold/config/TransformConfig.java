package com.exprfold.config;

/**
 * Configuration constants for transform pipelines.
 *
 * <p>The default iteration limit can be overridden at startup with the
 * {@value #MAX_ITERATIONS_PROPERTY} system property.
 */
public final class TransformConfig {

    private TransformConfig() {} // Utility class

    /** System property overriding the default pipeline iteration limit */
    public static final String MAX_ITERATIONS_PROPERTY = "exprfold.pipeline.maxIterations";

    /** Default number of pipeline iterations */
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    /** Upper bound to keep a misbehaving transformer from spinning */
    public static final int MAX_MAX_ITERATIONS = 100;

    /**
     * Validate and normalize an iteration limit to be within allowed bounds.
     *
     * @param requested the requested limit
     * @return normalized limit within [1, MAX_MAX_ITERATIONS]
     */
    public static int normalizeMaxIterations(int requested) {
        if (requested <= 0) return DEFAULT_MAX_ITERATIONS;
        if (requested > MAX_MAX_ITERATIONS) return MAX_MAX_ITERATIONS;
        return requested;
    }

    /**
     * Returns the configured default iteration limit.
     *
     * @return the value of {@value #MAX_ITERATIONS_PROPERTY}, normalized, or
     *         {@link #DEFAULT_MAX_ITERATIONS} when the property is unset
     * @throws IllegalArgumentException if the property is not an integer
     */
    public static int configuredMaxIterations() {
        String value = System.getProperty(MAX_ITERATIONS_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_MAX_ITERATIONS;
        }
        try {
            return normalizeMaxIterations(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Expected an integer".formatted(MAX_ITERATIONS_PROPERTY, value), e);
        }
    }
}
