package com.artinerary.domain.service.impl;

import com.artinerary.domain.config.EngageProperties;
import com.artinerary.domain.dto.ChatUnreadCount;
import com.artinerary.domain.dto.DirectChatSummary;
import com.artinerary.domain.entity.DirectChatEntity;
import com.artinerary.domain.entity.DirectChatLeaveEntity;
import com.artinerary.domain.entity.DirectMessageEntity;
import com.artinerary.domain.entity.EventEntity;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import com.artinerary.domain.mapper.DirectChatLeaveMapper;
import com.artinerary.domain.mapper.DirectChatMapper;
import com.artinerary.domain.mapper.DirectMessageMapper;
import com.artinerary.domain.mapper.EventMapper;
import com.artinerary.domain.service.DirectChatService;
import com.artinerary.domain.service.EventLookupService;
import com.artinerary.domain.service.EventMemberService;
import com.artinerary.domain.service.UserDirectory;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DirectChatServiceImpl extends ServiceImpl<DirectChatMapper, DirectChatEntity>
        implements DirectChatService {

    private final DirectMessageMapper messageMapper;
    private final DirectChatLeaveMapper leaveMapper;
    private final EventMapper eventMapper;
    private final EventLookupService eventLookup;
    private final EventMemberService memberService;
    private final UserDirectory userDirectory;
    private final EngageProperties props;

    @Transactional
    @Override
    public DirectChatEntity getOrCreateChat(long requesterId, long eventId, long otherUserId) {
        if (requesterId == otherUserId) {
            throw EngagementException.of(EngagementError.VALIDATION_ERROR, "cannot_chat_with_self");
        }
        eventLookup.requireActive(eventId);
        if (!userDirectory.exists(otherUserId)) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "user");
        }
        if (!memberService.userHasJoined(eventId, requesterId) || !memberService.userHasJoined(eventId, otherUserId)) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }

        long user1 = Math.min(requesterId, otherUserId);
        long user2 = Math.max(requesterId, otherUserId);
        DirectChatEntity existed = findPair(eventId, user1, user2, false);
        if (existed != null) {
            return existed;
        }

        DirectChatEntity chat = new DirectChatEntity();
        chat.setId(IdWorker.getId());
        chat.setEventId(eventId);
        chat.setUser1Id(user1);
        chat.setUser2Id(user2);
        try {
            this.save(chat);
        } catch (DuplicateKeyException e) {
            // locking read: sees the winner's committed row, not this transaction's snapshot
            DirectChatEntity winner = findPair(eventId, user1, user2, true);
            if (winner == null) {
                throw e;
            }
            return winner;
        }
        log.info("direct chat created: chatId={}, eventId={}, user1={}, user2={}", chat.getId(), eventId, user1, user2);
        return chat;
    }

    @Transactional
    @Override
    public DirectMessageEntity send(long senderId, long chatId, String text) {
        DirectChatEntity chat = requireParticipant(chatId, senderId);
        String content = text == null ? "" : text.trim();
        if (content.isEmpty() || content.length() > props.getDirectMessageMaxLength()) {
            throw EngagementException.of(EngagementError.INVALID_MESSAGE);
        }

        DirectMessageEntity msg = new DirectMessageEntity();
        msg.setId(IdWorker.getId());
        msg.setChatId(chatId);
        msg.setSenderId(senderId);
        msg.setContent(content);
        msg.setRead(false);
        messageMapper.insert(msg);

        this.update(new LambdaUpdateWrapper<DirectChatEntity>()
                .eq(DirectChatEntity::getId, chatId)
                .set(DirectChatEntity::getUpdatedAt, LocalDateTime.now()));

        Long other = chat.otherParticipant(senderId);
        int rejoined = leaveMapper.delete(new LambdaQueryWrapper<DirectChatLeaveEntity>()
                .eq(DirectChatLeaveEntity::getChatId, chatId)
                .eq(DirectChatLeaveEntity::getUserId, other));
        if (rejoined > 0) {
            log.debug("direct chat rejoined on send: chatId={}, userId={}", chatId, other);
        }
        return msg;
    }

    @Transactional
    @Override
    public void leave(long userId, long chatId) {
        requireParticipant(chatId, userId);
        long left = leaveMapper.selectCount(new LambdaQueryWrapper<DirectChatLeaveEntity>()
                .eq(DirectChatLeaveEntity::getChatId, chatId)
                .eq(DirectChatLeaveEntity::getUserId, userId));
        if (left > 0) {
            throw EngagementException.of(EngagementError.ALREADY_LEFT);
        }
        DirectChatLeaveEntity leave = new DirectChatLeaveEntity();
        leave.setId(IdWorker.getId());
        leave.setChatId(chatId);
        leave.setUserId(userId);
        try {
            leaveMapper.insert(leave);
        } catch (DuplicateKeyException e) {
            throw EngagementException.of(EngagementError.ALREADY_LEFT);
        }
        log.info("direct chat left: chatId={}, userId={}", chatId, userId);
    }

    @Override
    public List<Long> activeParticipants(long chatId) {
        DirectChatEntity chat = requireChat(chatId);
        Set<Long> left = leaveMapper.selectList(new LambdaQueryWrapper<DirectChatLeaveEntity>()
                        .eq(DirectChatLeaveEntity::getChatId, chatId))
                .stream()
                .map(DirectChatLeaveEntity::getUserId)
                .collect(Collectors.toSet());
        List<Long> out = new ArrayList<>(2);
        for (Long id : List.of(chat.getUser1Id(), chat.getUser2Id())) {
            if (!left.contains(id)) {
                out.add(id);
            }
        }
        return out;
    }

    @Transactional
    @Override
    public List<DirectMessageEntity> listMessages(long userId, long chatId) {
        requireParticipant(chatId, userId);
        messageMapper.markReadForReader(chatId, userId);
        return messageMapper.selectList(new LambdaQueryWrapper<DirectMessageEntity>()
                .eq(DirectMessageEntity::getChatId, chatId)
                .orderByAsc(DirectMessageEntity::getCreatedAt)
                .orderByAsc(DirectMessageEntity::getId));
    }

    @Override
    public List<DirectChatSummary> listChats(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        List<DirectChatEntity> chats = this.list(new LambdaQueryWrapper<DirectChatEntity>()
                .and(w -> w.eq(DirectChatEntity::getUser1Id, userId).or().eq(DirectChatEntity::getUser2Id, userId))
                .orderByDesc(DirectChatEntity::getUpdatedAt)
                .orderByDesc(DirectChatEntity::getId));
        if (chats.isEmpty()) {
            return List.of();
        }

        Set<Long> left = new HashSet<>();
        leaveMapper.selectList(new LambdaQueryWrapper<DirectChatLeaveEntity>()
                        .select(DirectChatLeaveEntity::getChatId)
                        .eq(DirectChatLeaveEntity::getUserId, userId))
                .forEach(l -> left.add(l.getChatId()));
        Set<Long> eventIds = chats.stream().map(DirectChatEntity::getEventId).collect(Collectors.toSet());
        Set<Long> activeEvents = eventMapper.selectBatchIds(eventIds).stream()
                .filter(EventEntity::isActive)
                .map(EventEntity::getId)
                .collect(Collectors.toSet());

        List<DirectChatEntity> visible = chats.stream()
                .filter(c -> !left.contains(c.getId()) && activeEvents.contains(c.getEventId()))
                .toList();
        if (visible.isEmpty()) {
            return List.of();
        }

        Map<Long, Long> unread = new HashMap<>();
        for (ChatUnreadCount c : messageMapper.countUnreadByChat(userId,
                visible.stream().map(DirectChatEntity::getId).toList())) {
            unread.put(c.getChatId(), c.getUnreadCount() == null ? 0L : c.getUnreadCount());
        }

        List<DirectChatSummary> out = new ArrayList<>(visible.size());
        for (DirectChatEntity c : visible) {
            DirectMessageEntity last = messageMapper.selectOne(new LambdaQueryWrapper<DirectMessageEntity>()
                    .eq(DirectMessageEntity::getChatId, c.getId())
                    .orderByDesc(DirectMessageEntity::getCreatedAt)
                    .orderByDesc(DirectMessageEntity::getId)
                    .last("limit 1"));
            out.add(new DirectChatSummary(c.getId(), c.getEventId(), c.otherParticipant(userId),
                    unread.getOrDefault(c.getId(), 0L), last, c.getUpdatedAt()));
        }
        return out;
    }

    private DirectChatEntity findPair(long eventId, long user1, long user2, boolean forUpdate) {
        return this.getOne(new LambdaQueryWrapper<DirectChatEntity>()
                .eq(DirectChatEntity::getEventId, eventId)
                .eq(DirectChatEntity::getUser1Id, user1)
                .eq(DirectChatEntity::getUser2Id, user2)
                .last(forUpdate ? "limit 1 for update" : "limit 1"));
    }

    private DirectChatEntity requireChat(long chatId) {
        DirectChatEntity chat = chatId <= 0 ? null : this.getById(chatId);
        if (chat == null) {
            throw EngagementException.of(EngagementError.NOT_FOUND, "chat");
        }
        return chat;
    }

    private DirectChatEntity requireParticipant(long chatId, long userId) {
        DirectChatEntity chat = requireChat(chatId);
        if (!chat.hasParticipant(userId)) {
            throw EngagementException.of(EngagementError.FORBIDDEN);
        }
        return chat;
    }
}
