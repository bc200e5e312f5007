package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.dto.FavoriteEventView;
import com.artinerary.domain.service.EventFavoriteService;
import com.artinerary.domain.service.EventLookupService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/event/favorite")
public class EventFavoriteController {

    private final EventFavoriteService favoriteService;
    private final EventLookupService eventLookup;

    public record FavoriteRequest(
            @NotBlank(message = "missing_slug") String slug
    ) {
    }

    public record FavoriteResponse(
            boolean favorited,
            boolean changed
    ) {
    }

    @PostMapping("/add")
    public Result<FavoriteResponse> add(@Valid @RequestBody FavoriteRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        boolean created = favoriteService.favorite(userId, eventLookup.resolveAnyId(req.slug()));
        return Result.ok(new FavoriteResponse(true, created));
    }

    @PostMapping("/remove")
    public Result<FavoriteResponse> remove(@Valid @RequestBody FavoriteRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        boolean removed = favoriteService.unfavorite(userId, eventLookup.resolveAnyId(req.slug()));
        return Result.ok(new FavoriteResponse(false, removed));
    }

    @GetMapping("/list")
    public Result<List<FavoriteEventView>> list() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(favoriteService.listFavorites(userId));
    }
}
