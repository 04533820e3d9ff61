package com.hotelhub.booking.domain.access;

import com.hotelhub.booking.domain.model.UserRole;

import java.util.Objects;

/**
 * Authenticated caller of one request. Built by the web layer from the identity headers set by the
 * gateway and handed to every service operation explicitly.
 */
public record Actor(Long userId, UserRole role) {

    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    public static Actor of(Long userId, UserRole role) {
        return new Actor(userId, role);
    }

    /** The scheduler acting on behalf of the hotel; owns no bookings. */
    public static Actor system() {
        return new Actor(0L, UserRole.ADMIN);
    }

    public boolean isStaff() {
        return role.isStaff();
    }

    public boolean owns(Long ownerId) {
        return userId.equals(ownerId);
    }
}
