package com.pumpd.backend.enums;

public enum TaskType {
    EMAIL("Email"),
    CALL("Call"),
    TEXT("Text"),
    SOCIAL_MESSAGE("Social Message"),
    DEMO_MEETING("Demo Meeting"),
    INTERNAL_ACTIVITY("Internal Activity");

    private final String displayName;

    TaskType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isEmail() {
        return this == EMAIL;
    }
}
