package com.pumpd.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens after a sequence is finished early.
 */
public enum FinishMode {
    FINISH_ONLY("finish-only"),
    FINISH_FOLLOWUP("finish-followup"),
    FINISH_START_NEW("finish-start-new");

    private final String value;

    FinishMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FinishMode fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (FinishMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown finish mode: " + value);
    }
}
