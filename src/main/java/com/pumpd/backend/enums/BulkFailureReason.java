package com.pumpd.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BulkFailureReason {
    NOT_FOUND("not_found"),
    VALIDATION_ERROR("validation_error"),
    SERVER_ERROR("server_error");

    private final String value;

    BulkFailureReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
