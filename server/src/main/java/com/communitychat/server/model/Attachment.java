package com.communitychat.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attachment {

    public static final String KIND_IMAGE = "image";
    public static final String KIND_FILE = "file";

    private String kind;

    // inline data: URL, mutually exclusive with url
    private String data;

    private String url;

    private String fileName;

    private Long fileSize;
}
