package com.artinerary.domain.service;

import com.artinerary.domain.dto.EventAccess;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.exception.EngagementError;
import org.springframework.stereotype.Component;

/**
 * Who may see and who may join an event. Pure: the caller loads the relationship.
 *
 * <ul>
 *   <li>PUBLIC_OPEN: anyone views; anyone not yet host/attendee joins.</li>
 *   <li>PUBLIC_INVITE: anyone views; joining needs a pending invite (approved requesters are already attendees).</li>
 *   <li>PRIVATE: host, members and invitees view; nobody joins directly.</li>
 * </ul>
 */
@Component
public class EventVisibilityPolicy {

    public boolean canView(EventEntity event, EventAccess access) {
        if (event == null || !event.isActive() || event.getVisibility() == null) {
            return false;
        }
        EventAccess a = access == null ? EventAccess.anonymous() : access;
        return switch (event.getVisibility()) {
            case PUBLIC_OPEN, PUBLIC_INVITE -> true;
            case PRIVATE -> a.isMember() || a.invited();
        };
    }

    /**
     * @return null when joining is allowed, otherwise the reason it is not
     */
    public EngagementError checkJoin(EventEntity event, EventAccess access) {
        if (event == null || !event.isActive() || event.getVisibility() == null) {
            return EngagementError.NOT_FOUND;
        }
        EventAccess a = access == null ? EventAccess.anonymous() : access;
        if (a.hasJoined()) {
            return EngagementError.ALREADY_JOINED;
        }
        return switch (event.getVisibility()) {
            case PUBLIC_OPEN -> null;
            case PUBLIC_INVITE -> a.pendingInvite() ? null : EngagementError.INVITE_REQUIRED;
            case PRIVATE -> EngagementError.PRIVATE_EVENT;
        };
    }

    public boolean canJoin(EventEntity event, EventAccess access) {
        return checkJoin(event, access) == null;
    }
}
