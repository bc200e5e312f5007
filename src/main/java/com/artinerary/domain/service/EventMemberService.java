package com.artinerary.domain.service;

import com.artinerary.domain.dto.EventAccess;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.entity.EventMemberEntity;
import com.artinerary.domain.enums.EventRole;
import com.artinerary.domain.enums.ViewerRole;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.Collection;
import java.util.List;

/**
 * Membership ledger: at most one role per (event, user).
 */
public interface EventMemberService extends IService<EventMemberEntity> {

    /**
     * Inserts the row, or changes the role of an existing one. A HOST row is never demoted.
     */
    void grant(long eventId, long userId, EventRole role);

    boolean hasRole(long eventId, long userId, Collection<EventRole> roles);

    /**
     * HOST or ATTENDEE.
     */
    boolean userHasJoined(long eventId, long userId);

    /**
     * Deletes the row holding exactly {@code role}; {@code not_a_member} if there is none.
     */
    void revoke(long eventId, long userId, EventRole role);

    /**
     * @return the role, or null without a membership row
     */
    EventRole roleOf(long eventId, long userId);

    ViewerRole viewerRole(EventEntity event, long userId);

    EventAccess accessOf(EventEntity event, long userId);

    /**
     * Direct join; an INVITED row is promoted in place.
     */
    void join(long userId, long eventId);

    void leave(long userId, long eventId);

    /**
     * HOST and ATTENDEE rows, earliest joined first.
     */
    List<EventMemberEntity> listAttendees(long eventId);

    /**
     * Event ids the user has joined as ATTENDEE.
     */
    List<Long> listAttendingEventIds(long userId);
}
