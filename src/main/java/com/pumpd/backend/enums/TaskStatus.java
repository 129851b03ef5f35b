package com.pumpd.backend.enums;

public enum TaskStatus {
    PENDING("Pending"),
    ACTIVE("Active"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled");

    private final String displayName;

    TaskStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isOpen() {
        return this == PENDING || this == ACTIVE;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
