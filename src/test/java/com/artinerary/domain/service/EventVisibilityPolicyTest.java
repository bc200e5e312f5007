package com.artinerary.domain.service;

import com.artinerary.domain.dto.EventAccess;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.exception.EngagementError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventVisibilityPolicyTest {

    private final EventVisibilityPolicy policy = new EventVisibilityPolicy();

    @Test
    void canView_ShouldAllowEveryoneOnPublicEvents() {
        EventAccess stranger = new EventAccess(7, false, null, false, false);

        assertThat(policy.canView(event(EventVisibility.PUBLIC_OPEN), stranger)).isTrue();
        assertThat(policy.canView(event(EventVisibility.PUBLIC_INVITE), stranger)).isTrue();
        assertThat(policy.canView(event(EventVisibility.PUBLIC_OPEN), EventAccess.anonymous())).isTrue();
    }

    @Test
    void canView_ShouldLimitPrivateEventsToHostMembersAndInvitees() {
        EventEntity e = event(EventVisibility.PRIVATE);

        assertThat(policy.canView(e, new EventAccess(1, true, EventRole.HOST, false, false))).isTrue();
        assertThat(policy.canView(e, new EventAccess(2, false, EventRole.ATTENDEE, true, false))).isTrue();
        assertThat(policy.canView(e, new EventAccess(3, false, null, true, false))).isTrue();
        assertThat(policy.canView(e, new EventAccess(4, false, null, false, false))).isFalse();
        assertThat(policy.canView(e, EventAccess.anonymous())).isFalse();
        assertThat(policy.canView(e, null)).isFalse();
    }

    @Test
    void canView_ShouldHideDeletedEvents() {
        EventEntity e = event(EventVisibility.PUBLIC_OPEN);
        e.setDeleted(true);

        assertThat(policy.canView(e, new EventAccess(1, true, EventRole.HOST, false, false))).isFalse();
    }

    @Test
    void checkJoin_ShouldAlwaysDenyPrivateEvents() {
        EventEntity e = event(EventVisibility.PRIVATE);

        assertThat(policy.checkJoin(e, new EventAccess(5, false, null, false, false)))
                .isEqualTo(EngagementError.PRIVATE_EVENT);
        assertThat(policy.checkJoin(e, new EventAccess(5, false, EventRole.INVITED, true, true)))
                .isEqualTo(EngagementError.PRIVATE_EVENT);
        assertThat(policy.checkJoin(e, new EventAccess(1, true, EventRole.HOST, false, false)))
                .isEqualTo(EngagementError.ALREADY_JOINED);
        assertThat(policy.canJoin(e, EventAccess.anonymous())).isFalse();
    }

    @Test
    void checkJoin_ShouldRequirePendingInviteOnInviteOnlyEvents() {
        EventEntity e = event(EventVisibility.PUBLIC_INVITE);

        assertThat(policy.checkJoin(e, new EventAccess(5, false, null, false, false)))
                .isEqualTo(EngagementError.INVITE_REQUIRED);
        // a declined invite is not enough
        assertThat(policy.checkJoin(e, new EventAccess(5, false, null, true, false)))
                .isEqualTo(EngagementError.INVITE_REQUIRED);
        assertThat(policy.checkJoin(e, new EventAccess(5, false, EventRole.INVITED, true, true))).isNull();
    }

    @Test
    void checkJoin_ShouldRejectHostAndAttendeesWithAlreadyJoined() {
        EventEntity e = event(EventVisibility.PUBLIC_OPEN);

        assertThat(policy.checkJoin(e, new EventAccess(5, false, null, false, false))).isNull();
        assertThat(policy.checkJoin(e, new EventAccess(5, false, EventRole.ATTENDEE, false, false)))
                .isEqualTo(EngagementError.ALREADY_JOINED);
        assertThat(policy.checkJoin(e, new EventAccess(1, true, EventRole.HOST, false, false)))
                .isEqualTo(EngagementError.ALREADY_JOINED);
    }

    @Test
    void checkJoin_ShouldReportMissingEventAsNotFound() {
        EventEntity deleted = event(EventVisibility.PUBLIC_OPEN);
        deleted.setDeleted(true);

        assertThat(policy.checkJoin(null, EventAccess.anonymous())).isEqualTo(EngagementError.NOT_FOUND);
        assertThat(policy.checkJoin(deleted, EventAccess.anonymous())).isEqualTo(EngagementError.NOT_FOUND);
    }

    private static EventEntity event(EventVisibility visibility) {
        EventEntity e = new EventEntity();
        e.setId(100L);
        e.setHostId(1L);
        e.setVisibility(visibility);
        e.setDeleted(false);
        return e;
    }
}
