package com.artinerary.domain.service;

import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

/**
 * Requests to join a PUBLIC_INVITE event without an invite; decided by the host.
 */
public interface EventJoinRequestService extends IService<EventJoinRequestEntity> {

    /**
     * Opens (or re-opens) the user's request. Idempotent while it is still pending.
     */
    EventJoinRequestEntity requestJoin(long userId, long eventId);

    EventJoinRequestEntity approve(long hostId, long requestId);

    EventJoinRequestEntity decline(long hostId, long requestId);

    /**
     * Pending requests of an event, oldest first; host only.
     */
    List<EventJoinRequestEntity> listPending(long hostId, long eventId);

    EventJoinRequestEntity findPending(long eventId, long userId);
}
