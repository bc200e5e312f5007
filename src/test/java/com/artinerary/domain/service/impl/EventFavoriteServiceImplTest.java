package com.artinerary.domain.service.impl;

import com.artinerary.domain.EngageIntegrationTestSupport;
import com.artinerary.domain.dto.FavoriteEventView;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.service.EventFavoriteService;
import com.artinerary.domain.service.EventMemberService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventFavoriteServiceImplTest extends EngageIntegrationTestSupport {

    @Autowired
    private EventFavoriteService favoriteService;

    @Autowired
    private EventMemberService memberService;

    @Test
    void favorite_ShouldBeIdempotent() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);

        assertThat(favoriteService.favorite(ALICE, e.getId())).isTrue();
        assertThat(favoriteService.favorite(ALICE, e.getId())).isFalse();

        assertThat(count("select count(*) from t_event_favorite where event_id = ? and user_id = ?", e.getId(), ALICE))
                .isEqualTo(1);
        assertThat(favoriteService.isFavorited(ALICE, e.getId())).isTrue();
    }

    @Test
    void unfavorite_ShouldReportWhetherARowWasRemoved() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        favoriteService.favorite(ALICE, e.getId());

        assertThat(favoriteService.unfavorite(ALICE, e.getId())).isTrue();
        assertThat(favoriteService.unfavorite(ALICE, e.getId())).isFalse();
        assertThat(favoriteService.unfavorite(BOB, e.getId())).isFalse();
    }

    @Test
    void favorite_ShouldRejectDeletedEvent() {
        EventEntity e = createEvent(EventVisibility.PUBLIC_OPEN);
        eventService.delete(HOST, e.getId());

        assertFails(EngagementError.CANNOT_FAVORITE_DELETED, () -> favoriteService.favorite(ALICE, e.getId()));
        assertFails(EngagementError.NOT_FOUND, () -> favoriteService.favorite(ALICE, 4242L));
    }

    @Test
    void listFavorites_ShouldSkipDeletedEventsAndFlagJoined() {
        EventEntity joined = createEvent("Mural Walk", EventVisibility.PUBLIC_OPEN);
        EventEntity watched = createEvent("Bridge Night", EventVisibility.PUBLIC_OPEN);
        EventEntity gone = createEvent("Cancelled Tour", EventVisibility.PUBLIC_OPEN);
        memberService.join(ALICE, joined.getId());
        favoriteService.favorite(ALICE, joined.getId());
        favoriteService.favorite(ALICE, watched.getId());
        favoriteService.favorite(ALICE, gone.getId());
        eventService.delete(HOST, gone.getId());

        List<FavoriteEventView> favs = favoriteService.listFavorites(ALICE);

        assertThat(favs).extracting(FavoriteEventView::eventId)
                .containsExactlyInAnyOrder(joined.getId(), watched.getId());
        assertThat(favs).filteredOn(FavoriteEventView::joined)
                .extracting(FavoriteEventView::eventId)
                .containsExactly(joined.getId());
    }
}
