package com.hotelhub.common.exception;

/**
 * No usable caller identity on the request. Mapped to HTTP 401.
 */
public class UnauthenticatedException extends BusinessException {
    public UnauthenticatedException(String message) {
        super(message, "UNAUTHENTICATED");
    }
}
