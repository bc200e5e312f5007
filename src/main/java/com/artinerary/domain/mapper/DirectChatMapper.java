package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.DirectChatEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface DirectChatMapper extends BaseMapper<DirectChatEntity> {
}
