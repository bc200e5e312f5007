package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventChatReportEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventChatReportMapper extends BaseMapper<EventChatReportEntity> {
}
