package com.artinerary.domain;

import com.artinerary.domain.dto.EventDraft;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.service.EventService;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Full context on an in-memory H2 database migrated by Flyway. Every test starts from
 * empty tables with a fixed set of users and art locations.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class EngageIntegrationTestSupport {

    protected static final long HOST = 1001L;
    protected static final long ALICE = 1002L;
    protected static final long BOB = 1003L;
    protected static final long CAROL = 1004L;
    protected static final long UNKNOWN_USER = 9999L;

    protected static final long LOC_MURAL = 501L;
    protected static final long LOC_STATUE = 502L;
    protected static final long LOC_FOUNTAIN = 503L;
    protected static final long LOC_ARCH = 504L;
    protected static final long LOC_BRIDGE = 505L;
    protected static final long LOC_PARK = 506L;

    private static final List<String> TABLES = List.of(
            "t_direct_chat_leave",
            "t_direct_message",
            "t_direct_chat",
            "t_event_chat_report",
            "t_event_chat_message",
            "t_event_favorite",
            "t_event_join_request",
            "t_event_invite",
            "t_event_member",
            "t_event_stop",
            "t_event",
            "t_user",
            "t_art_location");

    @Autowired
    protected JdbcTemplate jdbc;

    @Autowired
    protected EventService eventService;

    @BeforeEach
    void resetDatabase() {
        for (String t : TABLES) {
            jdbc.update("delete from " + t);
        }
        for (long id : new long[]{HOST, ALICE, BOB, CAROL}) {
            jdbc.update("insert into t_user (id, username) values (?, ?)", id, "user" + id);
        }
        String[] titles = {"Harbor Mural", "Bronze Statue", "Old Fountain", "Stone Arch", "Iron Bridge", "Sculpture Park"};
        long[] ids = {LOC_MURAL, LOC_STATUE, LOC_FOUNTAIN, LOC_ARCH, LOC_BRIDGE, LOC_PARK};
        for (int i = 0; i < ids.length; i++) {
            jdbc.update("insert into t_art_location (id, title) values (?, ?)", ids[i], titles[i]);
        }
    }

    protected EventEntity createEvent(EventVisibility visibility, Long... invitees) {
        return createEvent("Mural Walk", visibility, invitees);
    }

    protected EventEntity createEvent(String title, EventVisibility visibility, Long... invitees) {
        return eventService.create(HOST, draft(title, visibility), List.of(), List.of(invitees));
    }

    protected static EventDraft draft(String title, EventVisibility visibility) {
        return new EventDraft(title, "Bring a sketchbook", visibility,
                LocalDateTime.now().plusDays(7).withNano(0), LOC_MURAL);
    }

    protected int count(String sql, Object... args) {
        Integer n = jdbc.queryForObject(sql, Integer.class, args);
        return n == null ? 0 : n;
    }

    protected static void assertFails(EngagementError expected, ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(EngagementException.class)
                .extracting(e -> ((EngagementException) e).getError())
                .isEqualTo(expected);
    }
}
