package com.swarmmind.core.external;

import com.swarmmind.core.model.DiscoveredRepo;

import java.util.List;

/**
 * Finds repositories worth studying. Implementations return an empty list
 * instead of throwing when the source is unavailable.
 */
public interface RepositoryDiscovery {

    List<DiscoveredRepo> discover(String query, DiscoveryFilters filters);

    /** Recently created, already-starred repositories on a topic. */
    default List<DiscoveredRepo> trending(String topic, int sinceDays) {
        return List.of();
    }
}
