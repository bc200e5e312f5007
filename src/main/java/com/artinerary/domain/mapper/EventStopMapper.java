package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventStopEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventStopMapper extends BaseMapper<EventStopEntity> {
}
