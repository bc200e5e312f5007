package com.artinerary.domain.mapper;

import com.artinerary.domain.entity.EventFavoriteEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;

public interface EventFavoriteMapper extends BaseMapper<EventFavoriteEntity> {
}
