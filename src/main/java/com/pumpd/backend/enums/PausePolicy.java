package com.pumpd.backend.enums;

/**
 * How time spent paused affects the due date of the current step.
 */
public enum PausePolicy {
    /** Remaining delay is frozen while paused; resume pushes the due date back by the paused time. */
    FROZEN,
    /** Delay keeps elapsing in wall-clock time; resume leaves due dates untouched. */
    ELAPSING
}
