package com.communitychat.server.protocol;

import com.communitychat.server.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Getter;

@Getter
@JsonTypeName("error")
public class ErrorFrame extends OutboundFrame {

    private final ErrorCode code;

    private final String message;

    public ErrorFrame(ErrorCode code, String message) {
        this.code = code;
        this.message = message != null ? message : code.getMessage();
    }
}
