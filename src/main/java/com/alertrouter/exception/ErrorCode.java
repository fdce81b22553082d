package com.alertrouter.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    CHANNEL_ERROR("CHANNEL_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
