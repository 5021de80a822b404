package com.communitychat.server.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ban keyed by client device fingerprint. Checked only when a connection joins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BannedDevice {

    private String fingerprint;

    private String reason;

    private String bannedBy;

    private String createdAt; // ISO-8601 format

    @Builder.Default
    private List<String> affectedUserIds = new ArrayList<>();
}
