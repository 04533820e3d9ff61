package com.hotelhub.booking.api.controller;

import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.model.UserRole;
import com.hotelhub.common.exception.UnauthenticatedException;
import com.hotelhub.common.exception.ValidationException;

import java.util.Locale;

/**
 * Builds the {@link Actor} of a request from the identity headers forwarded by the gateway.
 */
final class RequestActors {

    private RequestActors() {
    }

    static Actor from(Long userId, String role) {
        if (userId == null || role == null || role.isBlank()) {
            throw new UnauthenticatedException("Missing caller identity");
        }
        try {
            return Actor.of(userId, UserRole.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown user role: " + role);
        }
    }
}
