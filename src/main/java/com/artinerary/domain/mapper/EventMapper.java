package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventMapper extends BaseMapper<EventEntity> {
}
