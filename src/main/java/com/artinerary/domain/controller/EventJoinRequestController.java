package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.artinerary.domain.service.EventJoinRequestService;
import com.artinerary.domain.service.EventLookupService;
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

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/event/join-request")
public class EventJoinRequestController {

    private final EventJoinRequestService joinRequestService;
    private final EventLookupService eventLookup;

    public record JoinRequest(
            @NotBlank(message = "missing_slug") String slug
    ) {
    }

    public record DecideRequest(
            @NotNull(message = "missing_request_id") Long requestId
    ) {
    }

    @PostMapping("/request")
    public Result<EventJoinRequestEntity> request(@Valid @RequestBody JoinRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(joinRequestService.requestJoin(userId, eventLookup.resolveId(req.slug())));
    }

    @GetMapping("/pending")
    public Result<List<EventJoinRequestEntity>> pending(@RequestParam String slug) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(joinRequestService.listPending(userId, eventLookup.resolveId(slug)));
    }

    @PostMapping("/approve")
    public Result<EventJoinRequestEntity> approve(@Valid @RequestBody DecideRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(joinRequestService.approve(userId, req.requestId()));
    }

    @PostMapping("/decline")
    public Result<EventJoinRequestEntity> decline(@Valid @RequestBody DecideRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(joinRequestService.decline(userId, req.requestId()));
    }
}
