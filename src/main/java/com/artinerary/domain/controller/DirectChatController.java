package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.dto.DirectChatSummary;
import com.artinerary.domain.entity.DirectChatEntity;
import com.artinerary.domain.entity.DirectMessageEntity;
import com.artinerary.domain.service.DirectChatService;
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
@RequestMapping("/event/dm")
public class DirectChatController {

    private final DirectChatService directChatService;
    private final EventLookupService eventLookup;

    public record OpenRequest(
            @NotBlank(message = "missing_slug") String slug,
            @NotNull(message = "missing_user_id") Long otherUserId
    ) {
    }

    public record SendRequest(
            @NotNull(message = "missing_chat_id") Long chatId,
            String content
    ) {
    }

    public record ChatRequest(
            @NotNull(message = "missing_chat_id") Long chatId
    ) {
    }

    @PostMapping("/open")
    public Result<DirectChatEntity> open(@Valid @RequestBody OpenRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(directChatService.getOrCreateChat(userId, eventLookup.resolveId(req.slug()), req.otherUserId()));
    }

    @PostMapping("/send")
    public Result<DirectMessageEntity> send(@Valid @RequestBody SendRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(directChatService.send(userId, req.chatId(), req.content()));
    }

    @PostMapping("/leave")
    public Result<Void> leave(@Valid @RequestBody ChatRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        directChatService.leave(userId, req.chatId());
        return Result.okVoid();
    }

    @GetMapping("/messages")
    public Result<List<DirectMessageEntity>> messages(@RequestParam Long chatId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(directChatService.listMessages(userId, chatId));
    }

    @GetMapping("/list")
    public Result<List<DirectChatSummary>> list() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(directChatService.listChats(userId));
    }
}
