package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JoinRequestStatus {

    PENDING(1, "pending"),
    APPROVED(2, "approved"),
    DECLINED(3, "declined");

    @EnumValue
    private final Integer code;

    private final String desc;

    public static JoinRequestStatus fromString(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim().toLowerCase();
        return switch (s) {
            case "pending" -> PENDING;
            case "approved" -> APPROVED;
            case "declined" -> DECLINED;
            default -> null;
        };
    }
}
