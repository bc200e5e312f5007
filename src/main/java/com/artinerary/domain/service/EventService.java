package com.artinerary.domain.service;

import com.artinerary.domain.dto.EventDetail;
import com.artinerary.domain.dto.EventDraft;
import com.artinerary.domain.entity.EventEntity;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.Collection;
import java.util.List;

/**
 * Event aggregate root: the event row, its ordered stops, and the host's membership.
 */
public interface EventService extends IService<EventEntity> {

    /**
     * Creates the event, the HOST membership, the stops (order 1..n) and the invites in one
     * transaction.
     *
     * @param stopLocationIds extra stops; at most {@code maxStops} before de-duplication
     */
    EventEntity create(long hostId, EventDraft draft, List<Long> stopLocationIds, Collection<Long> inviteeIds);

    /**
     * Host only. Stops are replaced wholesale; invites are only ever added.
     */
    EventEntity update(long hostId, long eventId, EventDraft draft, List<Long> stopLocationIds,
                       Collection<Long> inviteeIds);

    /**
     * Host only; soft delete.
     */
    void delete(long hostId, long eventId);

    /**
     * @param viewerId 0 for an anonymous viewer
     */
    EventDetail detail(long viewerId, long eventId);

    /**
     * Public events that are not deleted.
     *
     * @param query  matched against title, host username and start location title
     * @param filter {@code open} / {@code invite}, anything else for both
     * @param order  {@code start_time} (default) or {@code -start_time}
     */
    IPage<EventEntity> listPublic(String query, String filter, String order, long pageNo, long pageSize);

    List<EventEntity> listHosted(long userId);

    /**
     * Events the user attends (not hosts), soonest first.
     */
    List<EventEntity> listJoined(long userId);

    List<Long> listStopLocationIds(long eventId);
}
