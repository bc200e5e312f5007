package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventJoinRequestEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventJoinRequestMapper extends BaseMapper<EventJoinRequestEntity> {
}
