package com.quarry.dataframe;

import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable planner configuration carried by every {@link DataFrame}.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code maxLimit} - largest row count accepted by {@link DataFrame#limit(long)};
 *       unset by default. System property {@value #PROP_MAX_LIMIT}.</li>
 * </ul>
 */
public final class PlannerOptions {

    private static final Logger logger = LoggerFactory.getLogger(PlannerOptions.class);

    /** System property holding the maximum accepted limit */
    public static final String PROP_MAX_LIMIT = "quarry.planner.max-limit";

    private static final PlannerOptions DEFAULTS = new PlannerOptions(OptionalLong.empty());

    private final OptionalLong maxLimit;

    private PlannerOptions(OptionalLong maxLimit) {
        this.maxLimit = maxLimit;
    }

    /**
     * Returns the default options (no maximum limit).
     *
     * @return the defaults
     */
    public static PlannerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from system properties, falling back to the defaults for
     * properties that are not set.
     *
     * @return the configured options
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static PlannerOptions fromSystemProperties() {
        String value = System.getProperty(PROP_MAX_LIMIT);
        if (value == null || value.isBlank()) {
            return DEFAULTS;
        }

        long maxLimit;
        try {
            maxLimit = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Invalid value for %s: '%s' is not a number", PROP_MAX_LIMIT, value), e);
        }
        PlannerOptions options = DEFAULTS.withMaxLimit(maxLimit);
        logger.info("Planner max limit set to {} from {}", maxLimit, PROP_MAX_LIMIT);
        return options;
    }

    /**
     * Returns a copy with the given maximum limit.
     *
     * @param maxLimit the largest accepted limit (non-negative)
     * @return the new options
     * @throws IllegalArgumentException if maxLimit is negative
     */
    public PlannerOptions withMaxLimit(long maxLimit) {
        if (maxLimit < 0) {
            throw new IllegalArgumentException(
                String.format("%s must be non-negative, got %d", PROP_MAX_LIMIT, maxLimit));
        }
        return new PlannerOptions(OptionalLong.of(maxLimit));
    }

    /**
     * Returns the largest row count {@code limit} accepts, if configured.
     *
     * @return the maximum limit, or empty for no bound
     */
    public OptionalLong maxLimit() {
        return maxLimit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PlannerOptions)) return false;
        return maxLimit.equals(((PlannerOptions) obj).maxLimit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLimit);
    }

    @Override
    public String toString() {
        return "PlannerOptions(maxLimit=" + (maxLimit.isPresent() ? maxLimit.getAsLong() : "none") + ")";
    }
}
