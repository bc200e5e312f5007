package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum InviteStatus {

    PENDING(1, "pending"),
    ACCEPTED(2, "accepted"),
    DECLINED(3, "declined"),
    /** Reserved; no operation assigns it yet. */
    EXPIRED(4, "expired");

    @EnumValue
    private final Integer code;

    private final String desc;
}
