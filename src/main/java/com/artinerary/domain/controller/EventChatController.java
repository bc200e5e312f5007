package com.artinerary.domain.controller;

import com.artinerary.auth.web.AuthContext;
import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.entity.EventChatMessageEntity;
import com.artinerary.domain.entity.EventChatReportEntity;
import com.artinerary.domain.service.EventChatService;
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
@RequestMapping("/event/chat")
public class EventChatController {

    private final EventChatService chatService;
    private final EventLookupService eventLookup;

    public record SendRequest(
            @NotBlank(message = "missing_slug") String slug,
            String content
    ) {
    }

    public record ReportRequest(
            @NotNull(message = "missing_message_id") Long messageId,
            @NotBlank(message = "missing_reason") String reason,
            String description
    ) {
    }

    @PostMapping("/send")
    public Result<EventChatMessageEntity> send(@Valid @RequestBody SendRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatService.post(userId, eventLookup.resolveId(req.slug()), req.content()));
    }

    @GetMapping("/list")
    public Result<List<EventChatMessageEntity>> list(
            @RequestParam String slug,
            @RequestParam(defaultValue = "20") Integer limit
    ) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatService.listMessages(userId, eventLookup.resolveId(slug), limit == null ? 20 : limit));
    }

    @PostMapping("/report")
    public Result<EventChatReportEntity> report(@Valid @RequestBody ReportRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatService.report(userId, req.messageId(), req.reason(), req.description()));
    }
}
