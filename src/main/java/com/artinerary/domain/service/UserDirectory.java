package com.artinerary.domain.service;

import java.util.Collection;
import java.util.Set;

/**
 * Existence lookup for user ids. Accounts are owned by the account module.
 */
public interface UserDirectory {

    /**
     * @return the subset of {@code userIds} that resolve to a real user
     */
    Set<Long> existingIds(Collection<Long> userIds);

    default boolean exists(long userId) {
        return userId > 0 && existingIds(Set.of(userId)).contains(userId);
    }
}
