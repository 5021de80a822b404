package com.communitychat.server.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Machine-readable reason codes carried by {@code error} frames and HTTP error bodies.
 */
@Getter
public enum ErrorCode {
    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED, "Join the chat before sending requests"),
    DEVICE_BANNED(HttpStatus.FORBIDDEN, "This device has been banned from the chat"),
    RESTRICTED(HttpStatus.FORBIDDEN, "You are restricted from sending messages"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "You are not allowed to perform this action"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Message not found"),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Invalid request"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Chat storage is temporarily unavailable"),
    ;

    private final HttpStatus status;
    private final String message;

    ErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public ChatException exception() {
        return new ChatException(this);
    }

    public ChatException exception(String detail) {
        return new ChatException(this, detail);
    }
}
