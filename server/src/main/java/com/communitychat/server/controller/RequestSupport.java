package com.communitychat.server.controller;

import com.communitychat.server.error.ChatException;
import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.model.UserRole;
import com.communitychat.server.service.Actor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for the HTTP controllers: identity from the trusted upstream headers, and bounded waits
 * on coordinator results.
 */
final class RequestSupport {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_NAME_HEADER = "X-User-Name";
    static final String USER_ROLE_HEADER = "X-User-Role";

    private RequestSupport() {
    }

    static Actor actorFrom(String userId, String username, String role) {
        if (userId == null || userId.trim().isEmpty()) {
            throw ErrorCode.NOT_AUTHENTICATED.exception("Missing header " + USER_ID_HEADER);
        }
        UserRole userRole = UserRole.fromWireName(role);
        String name = username == null || username.trim().isEmpty() ? userId.trim() : username.trim();
        return new Actor(userId.trim(), name, userRole != null ? userRole : UserRole.USER);
    }

    static <T> T await(CompletableFuture<T> result, long timeoutMs) {
        try {
            return result.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!result.cancel(false)) {
                // already running on the coordinator, so its outcome is the answer
                return join(result);
            }
            throw new ChatException(ErrorCode.STORE_UNAVAILABLE, "Timed out waiting for the chat room", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatException(ErrorCode.STORE_UNAVAILABLE, "Interrupted waiting for the chat room", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static <T> T join(CompletableFuture<T> result) {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatException(ErrorCode.STORE_UNAVAILABLE, "Interrupted waiting for the chat room", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        if (e.getCause() instanceof ChatException) {
            return (ChatException) e.getCause();
        }
        return new IllegalStateException("Chat room operation failed", e.getCause());
    }
}
