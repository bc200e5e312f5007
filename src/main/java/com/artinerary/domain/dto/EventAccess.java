package com.artinerary.domain.dto;

import com.artinerary.domain.enums.EventRole;

/**
 * A user's existing relationship to one event, as input to the visibility policy.
 *
 * @param userId        the viewer; 0 for anonymous
 * @param host          viewer is the event host
 * @param role          membership role, null when the viewer has no membership row
 * @param invited       any invite row exists for the viewer, whatever its status
 * @param pendingInvite a PENDING invite exists for the viewer
 */
public record EventAccess(
        long userId,
        boolean host,
        EventRole role,
        boolean invited,
        boolean pendingInvite
) {

    public static EventAccess anonymous() {
        return new EventAccess(0, false, null, false, false);
    }

    public boolean hasJoined() {
        return host || (role != null && role.hasJoined());
    }

    public boolean isMember() {
        return host || role != null;
    }
}
