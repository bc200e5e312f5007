package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.dto.InvitationView;
import com.artinerary.domain.service.EventInviteService;
import com.artinerary.domain.service.EventLookupService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/event/invite")
public class EventInviteController {

    private final EventInviteService inviteService;
    private final EventLookupService eventLookup;

    public record InviteRequest(
            @NotBlank(message = "missing_slug") String slug,
            @NotEmpty(message = "missing_invitees") List<Long> inviteeIds
    ) {
    }

    public record InviteResponse(
            List<Long> invitedUserIds
    ) {
    }

    public record RespondRequest(
            @NotBlank(message = "missing_slug") String slug
    ) {
    }

    @PostMapping("/create")
    public Result<InviteResponse> create(@Valid @RequestBody InviteRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        List<Long> invited = inviteService.createInvites(userId, eventLookup.resolveId(req.slug()), req.inviteeIds());
        return Result.ok(new InviteResponse(invited));
    }

    @PostMapping("/accept")
    public Result<Void> accept(@Valid @RequestBody RespondRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        inviteService.accept(userId, eventLookup.resolveId(req.slug()));
        return Result.okVoid();
    }

    @PostMapping("/decline")
    public Result<Void> decline(@Valid @RequestBody RespondRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        inviteService.decline(userId, eventLookup.resolveId(req.slug()));
        return Result.okVoid();
    }

    @GetMapping("/pending")
    public Result<List<InvitationView>> pending() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(inviteService.listPendingForUser(userId));
    }
}
