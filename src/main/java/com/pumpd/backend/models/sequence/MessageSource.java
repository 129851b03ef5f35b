package com.pumpd.backend.models.sequence;

/**
 * Where a step's message text comes from.
 */
public interface MessageSource {

    /**
     * Points at a {@link MessageTemplate}. The step's own text is kept as a fallback
     * for when the template no longer resolves.
     */
    record TemplateRef(Long messageTemplateId, String fallbackText) implements MessageSource {
    }

    record Inline(String text) implements MessageSource {
    }

    static MessageSource of(Long messageTemplateId, String customMessage) {
        if (messageTemplateId != null) {
            return new TemplateRef(messageTemplateId, customMessage);
        }
        return new Inline(customMessage);
    }
}
