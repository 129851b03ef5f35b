package com.pumpd.backend.security;

/**
 * The organisation a request acts within, and the user acting.
 * Passed explicitly into every sequence operation.
 */
public record OrgContext(Long organisationId, String userId) {

    public OrgContext {
        if (organisationId == null) {
            throw new IllegalArgumentException("organisationId is required");
        }
    }
}
