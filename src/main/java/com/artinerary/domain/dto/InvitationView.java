package com.artinerary.domain.dto;

import java.time.LocalDateTime;

/**
 * A pending invitation as shown in the invitee's inbox.
 */
public record InvitationView(
        Long inviteId,
        Long eventId,
        String eventSlug,
        String eventTitle,
        Long hostId,
        Long inviterId,
        LocalDateTime startTime,
        LocalDateTime invitedAt
) {
}
