package com.artinerary.domain.service;

import com.artinerary.domain.dto.FavoriteEventView;
import com.artinerary.domain.entity.EventFavoriteEntity;
import com.baomidou.mybatisplus.extension.service.IService;

import java.util.List;

/**
 * Per-user event bookmarks; a row exists exactly while the event is favorited.
 */
public interface EventFavoriteService extends IService<EventFavoriteEntity> {

    /**
     * Get-or-create.
     *
     * @return true if a new row was written
     */
    boolean favorite(long userId, long eventId);

    /**
     * @return whether a row was actually removed
     */
    boolean unfavorite(long userId, long eventId);

    boolean isFavorited(long userId, long eventId);

    /**
     * Favorited events that are not deleted, most recently favorited first.
     */
    List<FavoriteEventView> listFavorites(long userId);
}
