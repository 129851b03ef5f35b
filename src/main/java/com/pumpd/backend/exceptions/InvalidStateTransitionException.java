package com.pumpd.backend.exceptions;

public class InvalidStateTransitionException extends RuntimeException {

    private final String currentState;
    private final String action;

    public InvalidStateTransitionException(String action, String currentState) {
        super("Cannot " + action + " a sequence that is " + currentState.toLowerCase());
        this.action = action;
        this.currentState = currentState;
    }

    public InvalidStateTransitionException(String action, String currentState, String message) {
        super(message);
        this.action = action;
        this.currentState = currentState;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getAction() {
        return action;
    }
}
