package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Event visibility tier (column t_event.visibility).
 *
 * <ul>
 *   <li>1 = public, anyone may join</li>
 *   <li>2 = public, joining needs an invite or an approved join request</li>
 *   <li>3 = private, host / members / invitees only</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum EventVisibility {

    PUBLIC_OPEN(1, "public_open"),

    PUBLIC_INVITE(2, "public_invite"),

    PRIVATE(3, "private");

    @EnumValue
    private final Integer code;

    private final String desc;

    public boolean isPublic() {
        return this != PRIVATE;
    }

    /**
     * Accepts the desc or its short form ({@code open} / {@code invite} / {@code private}).
     */
    public static EventVisibility fromString(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "open", "public_open" -> PUBLIC_OPEN;
            case "invite", "public_invite" -> PUBLIC_INVITE;
            case "private" -> PRIVATE;
            default -> null;
        };
    }

    /**
     * Listing filter values: {@code open} / {@code invite}; anything else means "no filter".
     */
    public static EventVisibility fromFilter(String raw) {
        EventVisibility v = fromString(raw);
        return v == null || v == PRIVATE ? null : v;
    }
}
