package com.artinerary.domain.dto;

import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.ViewerRole;

import java.util.List;

/**
 * Event page as seen by one viewer.
 *
 * @param stopLocationIds     extra stops in visiting order
 * @param pendingJoinRequest  the viewer's own open request, if any
 * @param pendingJoinRequests open requests awaiting the host; empty unless the viewer is the host
 */
public record EventDetail(
        EventEntity event,
        List<Long> stopLocationIds,
        List<EventMemberEntity> attendees,
        ViewerRole viewerRole,
        boolean joined,
        boolean favorited,
        boolean pendingInvite,
        boolean canJoin,
        boolean canRequestJoin,
        EventJoinRequestEntity pendingJoinRequest,
        List<EventJoinRequestEntity> pendingJoinRequests
) {
}
