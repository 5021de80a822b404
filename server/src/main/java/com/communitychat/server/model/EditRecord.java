package com.communitychat.server.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditRecord {

    private String content;

    private String editedAt; // ISO-8601 format
}
