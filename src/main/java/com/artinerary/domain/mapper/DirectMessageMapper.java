package com.artinerary.domain.mapper;

import com.artinerary.domain.dto.ChatUnreadCount;
import com.artinerary.domain.entity.DirectMessageEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface DirectMessageMapper extends BaseMapper<DirectMessageEntity> {

    /**
     * Marks everything the other participant sent as read for {@code readerId}.
     */
    @Update("""
            update t_direct_message
            set is_read = true
            where chat_id = #{chatId} and sender_id <> #{readerId} and is_read = false
            """)
    int markReadForReader(@Param("chatId") long chatId, @Param("readerId") long readerId);

    @Select("""
            <script>
            select chat_id, count(*) as unread_count
            from t_direct_message
            where is_read = false and sender_id &lt;&gt; #{readerId}
              and chat_id in
            <foreach collection="chatIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            group by chat_id
            </script>
            """)
    List<ChatUnreadCount> countUnreadByChat(@Param("readerId") long readerId, @Param("chatIds") List<Long> chatIds);
}
