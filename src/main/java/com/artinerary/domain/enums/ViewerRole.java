package com.artinerary.domain.enums;

/**
 * How the event detail page addresses the viewer. Not persisted.
 */
public enum ViewerRole {
    HOST,
    ATTENDEE,
    VISITOR
}
