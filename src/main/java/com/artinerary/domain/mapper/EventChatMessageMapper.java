package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventChatMessageEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface EventChatMessageMapper extends BaseMapper<EventChatMessageEntity> {

    /**
     * All message ids of an event, newest first. Ties on created_at fall back to the
     * snowflake id, which grows with insertion order.
     */
    @Select("""
            select id
            from t_event_chat_message
            where event_id = #{eventId}
            order by created_at desc, id desc
            """)
    List<Long> selectIdsNewestFirst(@Param("eventId") long eventId);
}
