package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventInviteEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventInviteMapper extends BaseMapper<EventInviteEntity> {
}
