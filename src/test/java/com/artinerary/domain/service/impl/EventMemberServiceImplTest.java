package com.artinerary.domain.service.impl;

import com.artinerary.domain.EngageIntegrationTestSupport;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.enums.ViewerRole;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.service.EventMemberService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventMemberServiceImplTest extends EngageIntegrationTestSupport {

    @Autowired
    private EventMemberService memberService;

    @Test
    void join_ShouldMakeAttendee_AndSecondJoinFailsWithAlreadyJoined() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);

        memberService.join(ALICE, e.getId());

        assertThat(memberService.hasRole(e.getId(), ALICE, List.of(EventRole.ATTENDEE))).isTrue();
        assertThat(memberService.userHasJoined(e.getId(), ALICE)).isTrue();
        assertFails(EngagementError.ALREADY_JOINED, () -> memberService.join(ALICE, e.getId()));
        assertThat(count("select count(*) from t_event_member where event_id = ? and user_id = ?", e.getId(), ALICE))
                .isEqualTo(1);
    }

    @Test
    void join_ShouldRejectHost() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);

        assertFails(EngagementError.ALREADY_JOINED, () -> memberService.join(HOST, e.getId()));
    }

    @Test
    void join_ShouldRejectPrivateEventEvenForInvitee() {
        EventEntity e = createEvent(EventVisibility.PRIVATE, ALICE);

        assertFails(EngagementError.PRIVATE_EVENT, () -> memberService.join(ALICE, e.getId()));
        assertFails(EngagementError.PRIVATE_EVENT, () -> memberService.join(BOB, e.getId()));
    }

    @Test
    void join_ShouldRequirePendingInviteOnInviteOnlyEvent() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE, ALICE);

        assertFails(EngagementError.INVITE_REQUIRED, () -> memberService.join(BOB, e.getId()));

        memberService.join(ALICE, e.getId());
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.ATTENDEE);
        // promoted in place, not a second row
        assertThat(count("select count(*) from t_event_member where event_id = ? and user_id = ?", e.getId(), ALICE))
                .isEqualTo(1);
    }

    @Test
    void join_ShouldFailForDeletedEventAndUnknownUser() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);

        assertFails(EngagementError.NOT_FOUND, () -> memberService.join(UNKNOWN_USER, e.getId()));

        eventService.delete(HOST, e.getId());
        assertFails(EngagementError.NOT_FOUND, () -> memberService.join(ALICE, e.getId()));
    }

    @Test
    void join_ConcurrentCallsForSameUser_ShouldLeaveExactlyOneMembership() throws Exception {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<EngagementError> attempt = () -> {
                start.await();
                try {
                    memberService.join(BOB, e.getId());
                    return null;
                } catch (EngagementException ex) {
                    return ex.getError();
                }
            };
            List<Future<EngagementError>> futures = new ArrayList<>();
            futures.add(pool.submit(attempt));
            futures.add(pool.submit(attempt));
            start.countDown();

            List<EngagementError> outcomes = new ArrayList<>();
            for (Future<EngagementError> f : futures) {
                outcomes.add(f.get(30, TimeUnit.SECONDS));
            }
            assertThat(outcomes).containsExactlyInAnyOrder(null, EngagementError.ALREADY_JOINED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(count("select count(*) from t_event_member where event_id = ? and user_id = ?", e.getId(), BOB))
                .isEqualTo(1);
    }

    @Test
    void leave_ShouldRemoveAttendee() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        memberService.join(ALICE, e.getId());

        memberService.leave(ALICE, e.getId());

        assertThat(memberService.roleOf(e.getId(), ALICE)).isNull();
        assertFails(EngagementError.NOT_REGISTERED, () -> memberService.leave(ALICE, e.getId()));
    }

    @Test
    void leave_ShouldRejectHostAndInvitedUsers() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE, ALICE);

        assertFails(EngagementError.HOST_CANNOT_LEAVE, () -> memberService.leave(HOST, e.getId()));
        assertFails(EngagementError.NOT_REGISTERED, () -> memberService.leave(ALICE, e.getId()));
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.INVITED);
    }

    @Test
    void revoke_ShouldOnlyDeleteMatchingRole() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE, ALICE);

        assertFails(EngagementError.NOT_A_MEMBER, () -> memberService.revoke(e.getId(), ALICE, EventRole.ATTENDEE));
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.INVITED);

        memberService.revoke(e.getId(), ALICE, EventRole.INVITED);
        assertThat(memberService.roleOf(e.getId(), ALICE)).isNull();
    }

    @Test
    void grant_ShouldUpsertAndNeverDemoteHost() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);

        memberService.grant(e.getId(), BOB, EventRole.INVITED);
        memberService.grant(e.getId(), BOB, EventRole.ATTENDEE);
        memberService.grant(e.getId(), HOST, EventRole.ATTENDEE);

        assertThat(memberService.roleOf(e.getId(), BOB)).isEqualTo(EventRole.ATTENDEE);
        assertThat(memberService.roleOf(e.getId(), HOST)).isEqualTo(EventRole.HOST);
        assertThat(count("select count(*) from t_event_member where event_id = ?", e.getId())).isEqualTo(2);
    }

    @Test
    void grant_ShouldNotDemoteAttendeeBackToInvited() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        memberService.join(BOB, e.getId());

        memberService.grant(e.getId(), BOB, EventRole.INVITED);

        assertThat(memberService.roleOf(e.getId(), BOB)).isEqualTo(EventRole.ATTENDEE);
        assertThat(count("select count(*) from t_event_member where event_id = ? and user_id = ?", e.getId(), BOB))
                .isEqualTo(1);
    }

    @Test
    void listAttendees_ShouldIncludeHostAndAttendeesOnly() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN, CAROL);
        memberService.join(ALICE, e.getId());

        List<Long> ids = memberService.listAttendees(e.getId()).stream().map(EventMemberEntity::getUserId).toList();

        assertThat(ids).containsExactlyInAnyOrder(HOST, ALICE);
        assertThat(memberService.listAttendingEventIds(ALICE)).containsExactly(e.getId());
        assertThat(memberService.listAttendingEventIds(HOST)).isEmpty();
    }

    @Test
    void viewerRole_ShouldDistinguishHostAttendeeAndVisitor() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN, CAROL);
        memberService.join(ALICE, e.getId());

        assertThat(memberService.viewerRole(e, HOST)).isEqualTo(ViewerRole.HOST);
        assertThat(memberService.viewerRole(e, ALICE)).isEqualTo(ViewerRole.ATTENDEE);
        assertThat(memberService.viewerRole(e, CAROL)).isEqualTo(ViewerRole.VISITOR);
        assertThat(memberService.viewerRole(e, 0)).isEqualTo(ViewerRole.VISITOR);
    }
}
