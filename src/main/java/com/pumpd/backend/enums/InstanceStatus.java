package com.pumpd.backend.enums;

public enum InstanceStatus {
    ACTIVE("Active"),
    PAUSED("Paused"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled");

    private final String displayName;

    InstanceStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    public boolean isRunning() {
        return this == ACTIVE || this == PAUSED;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }
}
