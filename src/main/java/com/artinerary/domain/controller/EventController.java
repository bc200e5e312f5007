package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.dto.EventDetail;
import com.artinerary.domain.dto.EventDraft;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.enums.EventVisibility;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.artinerary.domain.service.EventService;
import com.baomidou.mybatisplus.core.metadata.IPage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/event")
public class EventController {

    private final EventService eventService;
    private final EventMemberService memberService;
    private final EventLookupService eventLookup;

    public record EventForm(
            @NotBlank(message = "missing_title") String title,
            String description,
            @NotBlank(message = "missing_visibility") String visibility,
            @NotNull(message = "missing_start_time") LocalDateTime startTime,
            @NotNull(message = "missing_start_location") Long startLocationId,
            List<Long> stopLocationIds,
            List<Long> inviteeIds
    ) {
        EventDraft toDraft() {
            EventVisibility v = EventVisibility.fromString(visibility);
            if (v == null) {
                throw new IllegalArgumentException("bad_visibility");
            }
            return new EventDraft(title, description, v, startTime, startLocationId);
        }
    }

    public record UpdateRequest(
            @NotBlank(message = "missing_slug") String slug,
            @NotNull(message = "missing_event") @Valid EventForm event
    ) {
    }

    public record SlugRequest(
            @NotBlank(message = "missing_slug") String slug
    ) {
    }

    @PostMapping("/create")
    public Result<EventEntity> create(@Valid @RequestBody EventForm req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(eventService.create(userId, req.toDraft(), req.stopLocationIds(), req.inviteeIds()));
    }

    @PostMapping("/update")
    public Result<EventEntity> update(@Valid @RequestBody UpdateRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        EventForm f = req.event();
        long eventId = eventLookup.resolveId(req.slug());
        return Result.ok(eventService.update(userId, eventId, f.toDraft(), f.stopLocationIds(), f.inviteeIds()));
    }

    @PostMapping("/delete")
    public Result<Void> delete(@Valid @RequestBody SlugRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        eventService.delete(userId, eventLookup.resolveId(req.slug()));
        return Result.okVoid();
    }

    /**
     * Anonymous viewers are allowed; they only see public events.
     */
    @GetMapping("/detail")
    public Result<EventDetail> detail(@RequestParam String slug) {
        Long userId = AuthContext.getUserId();
        return Result.ok(eventService.detail(userId == null ? 0 : userId, eventLookup.resolveId(slug)));
    }

    @GetMapping("/public")
    public Result<IPage<EventEntity>> listPublic(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String filter,
            @RequestParam(defaultValue = "start_time") String order,
            @RequestParam(defaultValue = "1") Long page,
            @RequestParam(defaultValue = "20") Long size
    ) {
        return Result.ok(eventService.listPublic(q, filter, order,
                page == null ? 1 : page, size == null ? 20 : size));
    }

    @GetMapping("/hosted")
    public Result<List<EventEntity>> hosted() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(eventService.listHosted(userId));
    }

    @GetMapping("/joined")
    public Result<List<EventEntity>> joined() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(eventService.listJoined(userId));
    }

    @PostMapping("/join")
    public Result<Void> join(@Valid @RequestBody SlugRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        memberService.join(userId, eventLookup.resolveId(req.slug()));
        return Result.okVoid();
    }

    @PostMapping("/leave")
    public Result<Void> leave(@Valid @RequestBody SlugRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        memberService.leave(userId, eventLookup.resolveId(req.slug()));
        return Result.okVoid();
    }
}
