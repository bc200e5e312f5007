package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventMemberEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventMemberMapper extends BaseMapper<EventMemberEntity> {
}
