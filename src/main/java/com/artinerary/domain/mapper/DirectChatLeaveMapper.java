package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.DirectChatLeaveEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface DirectChatLeaveMapper extends BaseMapper<DirectChatLeaveEntity> {
}
