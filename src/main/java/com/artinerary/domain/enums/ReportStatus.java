package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Moderation state of a chat report. Only OPEN is assigned here; the moderation
 * screens that move reports on are outside this service.
 */
@Getter
@RequiredArgsConstructor
public enum ReportStatus {

    OPEN(1, "open"),
    REVIEWED(2, "reviewed"),
    DISMISSED(3, "dismissed");

    @EnumValue
    private final Integer code;

    private final String desc;
}
