package com.hotelhub.booking.domain.access;

/**
 * Capabilities checked by {@link BookingAccessPolicy}.
 */
public enum BookingAction {
    VIEW(Rule.OWNER_OR_STAFF, "view"),
    LIST_ALL(Rule.STAFF_ONLY, "list all bookings"),
    UPDATE(Rule.OWNER_OR_STAFF, "update"),
    CANCEL(Rule.OWNER_OR_STAFF, "cancel"),
    EXTEND(Rule.OWNER_ONLY, "extend"),
    CONFIRM(Rule.STAFF_ONLY, "confirm"),
    DECLINE(Rule.STAFF_ONLY, "decline"),
    COMPLETE(Rule.STAFF_ONLY, "complete"),
    DELETE(Rule.STAFF_ONLY, "delete"),
    VIEW_OCCUPANCY(Rule.STAFF_ONLY, "view room occupancy");

    enum Rule {
        OWNER_ONLY,
        OWNER_OR_STAFF,
        STAFF_ONLY
    }

    private final Rule rule;
    private final String verb;

    BookingAction(Rule rule, String verb) {
        this.rule = rule;
        this.verb = verb;
    }

    Rule rule() {
        return rule;
    }

    public String describe() {
        return verb;
    }
}
