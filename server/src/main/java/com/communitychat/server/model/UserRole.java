package com.communitychat.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chat roles, ordered by privilege.
 */
public enum UserRole {
    USER("user"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    private final String wireName;

    UserRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isModerator() {
        return this != USER;
    }

    public boolean outranks(UserRole other) {
        return ordinal() > other.ordinal();
    }

    @JsonCreator
    public static UserRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (UserRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value.trim()) || role.name().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        return null;
    }

    /**
     * Resolves the role claim sent on join. Older clients only send an isAdmin flag.
     */
    public static UserRole fromClaim(String roleClaim, Boolean isAdmin) {
        UserRole role = fromWireName(roleClaim);
        if (role != null) {
            return role;
        }
        return Boolean.TRUE.equals(isAdmin) ? ADMIN : USER;
    }
}
