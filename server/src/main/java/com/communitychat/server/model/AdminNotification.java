package com.communitychat.server.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminNotification {

    public static final String TYPE_CHAT_TAG = "chat_tag";

    private String id;

    private String type;

    private String title;

    private String message;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private boolean read;

    private String createdAt; // ISO-8601 format
}
