package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReportReason {

    SPAM(1, "spam"),
    HARASSMENT(2, "harassment"),
    INAPPROPRIATE(3, "inappropriate"),
    OTHER(4, "other");

    @EnumValue
    private final Integer code;

    private final String desc;

    /**
     * Accepts the enum name or its lower-case desc; null for anything unknown.
     */
    public static ReportReason fromString(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim().toLowerCase();
        for (ReportReason r : values()) {
            if (r.desc.equals(s)) {
                return r;
            }
        }
        return null;
    }
}
