package com.artinerary.domain.service;

import java.util.Collection;
import java.util.Set;

/**
 * Existence lookup for art-location ids. The catalog is owned by the locations module.
 */
public interface LocationDirectory {

    /**
     * @return the subset of {@code locationIds} that resolve to a known location
     */
    Set<Long> existingIds(Collection<Long> locationIds);

    default boolean exists(long locationId) {
        return locationId > 0 && existingIds(Set.of(locationId)).contains(locationId);
    }
}
