package com.communitychat.server.error;

/**
 * A durable read or write failed. The mutation in progress is not applied.
 */
public class StoreUnavailableException extends ChatException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, "Chat storage unavailable during " + operation, cause);
    }
}
