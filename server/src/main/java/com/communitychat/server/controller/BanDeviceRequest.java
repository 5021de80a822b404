package com.communitychat.server.controller;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BanDeviceRequest {

    private String fingerprint;

    private String reason;

    private List<String> affectedUserIds = new ArrayList<>();
}
