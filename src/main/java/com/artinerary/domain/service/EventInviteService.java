package com.artinerary.domain.service;

import com.artinerary.domain.dto.InvitationView;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventInviteEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.Collection;
import java.util.List;

public interface EventInviteService extends IService<EventInviteEntity> {

    /**
     * Host-only entry point over {@link #inviteUsers(EventEntity, Collection)}.
     */
    List<Long> createInvites(long hostId, long eventId, Collection<Long> inviteeIds);

    /**
     * Creates a PENDING invite plus an INVITED membership row for each invitee that has
     * neither an invite nor a membership yet. The host and unknown users are never invited.
     *
     * @return the user ids that were actually invited, in input order
     */
    List<Long> inviteUsers(EventEntity event, Collection<Long> inviteeIds);

    void accept(long userId, long eventId);

    void decline(long userId, long eventId);

    EventInviteEntity findPending(long eventId, long userId);

    /**
     * PENDING invites of the user on events that are not deleted, oldest first.
     */
    List<InvitationView> listPendingForUser(long userId);

    /**
     * Invitee ids of the event, whatever the invite status.
     */
    List<Long> listInviteeIds(long eventId);
}
