package io.poolscope.config;

import java.util.Set;

/**
 * Merge behavior of one engine instance.
 *
 * @param allowEmpty   treat zero values ({@code 0}, {@code ""}, {@code false}) as real overrides
 * @param shallowMerge replace whole top-level fields instead of merging them recursively
 * @param allowedPools pools the consumer intends to configure; informational, not enforced here
 */
public record EngineOptions(boolean allowEmpty, boolean shallowMerge, Set<String> allowedPools) {
    private static final EngineOptions DEFAULTS = new EngineOptions(false, false, Set.of());

    public EngineOptions {
        allowedPools = allowedPools == null ? Set.of() : Set.copyOf(allowedPools);
    }

    public static EngineOptions defaults() {
        return DEFAULTS;
    }

    public EngineOptions withAllowEmpty(boolean value) {
        return new EngineOptions(value, shallowMerge, allowedPools);
    }

    public EngineOptions withShallowMerge(boolean value) {
        return new EngineOptions(allowEmpty, value, allowedPools);
    }

    public EngineOptions withAllowedPools(Set<String> pools) {
        return new EngineOptions(allowEmpty, shallowMerge, pools);
    }
}
