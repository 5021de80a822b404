package com.communitychat.server.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ErrorResponse> handleChatException(ChatException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode == ErrorCode.STORE_UNAVAILABLE) {
            log.error("ChatException: {}", e.getMessage(), e);
        } else {
            log.warn("ChatException: {} - {}", errorCode, e.getMessage());
        }
        ErrorResponse response = ErrorResponse.builder()
                .code(errorCode.name())
                .message(e.getMessage())
                .build();
        return new ResponseEntity<>(response, errorCode.getStatus());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.NOT_AUTHENTICATED.name())
                .message("Missing header " + e.getHeaderName())
                .build();
        return new ResponseEntity<>(response, ErrorCode.NOT_AUTHENTICATED.getStatus());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.VALIDATION_FAILED.name())
                .message("Malformed request body")
                .build();
        return new ResponseEntity<>(response, ErrorCode.VALIDATION_FAILED.getStatus());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.VALIDATION_FAILED.name())
                .message("Upload exceeds the maximum allowed size")
                .build();
        return new ResponseEntity<>(response, ErrorCode.VALIDATION_FAILED.getStatus());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        ErrorResponse response = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("Internal Server Error")
                .build();
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
