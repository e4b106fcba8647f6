package com.swarmmind.core.external;

/**
 * Narrowing options for repository discovery.
 *
 * @param language  primary language to require, or null for any
 * @param minStars  minimum star count (0 for no minimum)
 * @param limit     maximum number of results
 */
public record DiscoveryFilters(String language, int minStars, int limit) {

    public static DiscoveryFilters limit(int limit) {
        return new DiscoveryFilters(null, 0, limit);
    }

    public static DiscoveryFilters popular(int minStars, int limit) {
        return new DiscoveryFilters(null, minStars, limit);
    }
}
