package com.hotelhub.common.util;

/**
 * Common constants used across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String HEADER_USER_ROLE = "X-User-Role";

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
}
