package com.artinerary.domain.service.impl;

import com.artinerary.domain.EngageIntegrationTestSupport;
import com.artinerary.domain.dto.InvitationView;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventInviteEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.enums.InviteStatus;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.service.EventInviteService;
import com.artinerary.domain.service.EventMemberService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventInviteServiceImplTest extends EngageIntegrationTestSupport {

    @Autowired
    private EventInviteService inviteService;

    @Autowired
    private EventMemberService memberService;

    @Test
    void createInvites_ShouldDedupeAndPairEachInviteWithInvitedMembership() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE);

        List<Long> invited = inviteService.createInvites(HOST, e.getId(), List.of(ALICE, ALICE, HOST));

        assertThat(invited).containsExactly(ALICE);
        assertThat(count("select count(*) from t_event_invite where event_id = ?", e.getId())).isEqualTo(1);
        assertThat(count("select count(*) from t_event_member where event_id = ? and role = 3", e.getId())).isEqualTo(1);
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.INVITED);
    }

    @Test
    void createInvites_ShouldOnlyAddNewIdsOnOverlap() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE, ALICE);
        Long firstInviteId = inviteService.findPending(e.getId(), ALICE).getId();

        List<Long> invited = inviteService.createInvites(HOST, e.getId(), List.of(ALICE, BOB));

        assertThat(invited).containsExactly(BOB);
        assertThat(inviteService.findPending(e.getId(), ALICE).getId()).isEqualTo(firstInviteId);
        assertThat(inviteService.listInviteeIds(e.getId())).containsExactlyInAnyOrder(ALICE, BOB);
    }

    @Test
    void createInvites_ShouldSkipExistingMembers() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        memberService.join(ALICE, e.getId());

        assertThat(inviteService.createInvites(HOST, e.getId(), List.of(ALICE))).isEmpty();
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.ATTENDEE);
    }

    @Test
    void createInvites_ShouldRejectUnknownUsersAndNonHosts() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE);

        assertFails(EngagementError.VALIDATION_ERROR,
                () -> inviteService.createInvites(HOST, e.getId(), List.of(ALICE, UNKNOWN_USER)));
        // all-or-nothing: ALICE was not invited either
        assertThat(inviteService.findPending(e.getId(), ALICE)).isNull();

        assertFails(EngagementError.FORBIDDEN, () -> inviteService.createInvites(ALICE, e.getId(), List.of(BOB)));
    }

    @Test
    void accept_ShouldStampResponseAndPromoteToAttendee() {
        EventEntity e = createEvent(EventVisibility.PRIVATE, ALICE);

        inviteService.accept(ALICE, e.getId());

        EventInviteEntity invite = inviteService.getOne(new LambdaQueryWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getEventId, e.getId())
                .eq(EventInviteEntity::getInviteeId, ALICE));
        assertThat(invite.getStatus()).isEqualTo(InviteStatus.ACCEPTED);
        assertThat(invite.getRespondedAt()).isNotNull();
        assertThat(memberService.roleOf(e.getId(), ALICE)).isEqualTo(EventRole.ATTENDEE);

        assertFails(EngagementError.NOT_FOUND, () -> inviteService.accept(ALICE, e.getId()));
    }

    @Test
    void decline_ShouldStampResponseAndDropInvitedMembership() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE, ALICE);

        inviteService.decline(ALICE, e.getId());

        EventInviteEntity invite = inviteService.getOne(new LambdaQueryWrapper<EventInviteEntity>()
                .eq(EventInviteEntity::getEventId, e.getId())
                .eq(EventInviteEntity::getInviteeId, ALICE));
        assertThat(invite.getStatus()).isEqualTo(InviteStatus.DECLINED);
        assertThat(invite.getRespondedAt()).isNotNull();
        assertThat(memberService.roleOf(e.getId(), ALICE)).isNull();
        assertFails(EngagementError.NOT_FOUND, () -> inviteService.decline(ALICE, e.getId()));
    }

    @Test
    void accept_ShouldFailWithoutInvite() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_INVITE);

        assertFails(EngagementError.NOT_FOUND, () -> inviteService.accept(BOB, e.getId()));
    }

    @Test
    void listPendingForUser_ShouldSkipAnsweredInvitesAndDeletedEvents() {
        EventEntity first = createEvent("Mural Walk", EventVisibility.PRIVATE, ALICE);
        EventEntity second = createEvent("Statue Tour", EventVisibility.PUBLIC_INVITE, ALICE);
        EventEntity third = createEvent("Fountain Sketching", EventVisibility.PUBLIC_INVITE, ALICE);
        inviteService.decline(ALICE, second.getId());
        eventService.delete(HOST, third.getId());

        List<InvitationView> pending = inviteService.listPendingForUser(ALICE);

        assertThat(pending).extracting(InvitationView::eventId).containsExactly(first.getId());
        assertThat(pending.get(0).eventSlug()).isEqualTo(first.getSlug());
        assertThat(pending.get(0).inviterId()).isEqualTo(HOST);
    }
}
