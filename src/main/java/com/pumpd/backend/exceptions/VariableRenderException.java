package com.pumpd.backend.exceptions;

/**
 * A computed message variable failed to produce a value.
 * Only used inside variable resolution, callers never see it.
 */
public class VariableRenderException extends RuntimeException {

    private final String variableName;

    public VariableRenderException(String variableName, Throwable cause) {
        super("Failed to render variable {" + variableName + "}: " + cause.getMessage(), cause);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
