package com.artinerary.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Membership role (column t_event_member.role).
 *
 * <ul>
 *   <li>1 = host, the creator; cannot leave</li>
 *   <li>2 = attendee, confirmed participant</li>
 *   <li>3 = invited, provisional row paired with a pending invite</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum EventRole {

    HOST(1, "host"),

    ATTENDEE(2, "attendee"),

    INVITED(3, "invited");

    /** Roles that count as "joined": may chat, may open direct chats. */
    public static final Set<EventRole> JOINED = EnumSet.of(HOST, ATTENDEE);

    @EnumValue
    private final Integer code;

    private final String desc;

    public boolean hasJoined() {
        return JOINED.contains(this);
    }

    /**
     * Roles ranked above this one; a grant never replaces them. Lower code means higher rank.
     */
    public Set<EventRole> higherRoles() {
        Set<EventRole> higher = EnumSet.noneOf(EventRole.class);
        for (EventRole r : values()) {
            if (r.code < this.code) {
                higher.add(r);
            }
        }
        return higher;
    }
}
