package com.hotelhub.booking.domain.model;

public enum UserRole {
    USER,
    MANAGER,
    ADMIN;

    public boolean isStaff() {
        return this == MANAGER || this == ADMIN;
    }
}
