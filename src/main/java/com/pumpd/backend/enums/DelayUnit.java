package com.pumpd.backend.enums;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

public enum DelayUnit {
    MINUTES("minute", ChronoUnit.MINUTES),
    HOURS("hour", ChronoUnit.HOURS),
    DAYS("day", ChronoUnit.DAYS);

    private final String label;
    private final ChronoUnit chronoUnit;

    DelayUnit(String label, ChronoUnit chronoUnit) {
        this.label = label;
        this.chronoUnit = chronoUnit;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Adds the delay keeping the offset of {@code from}, so a DAYS delay is always a whole number of 24 hours.
     */
    public OffsetDateTime addTo(OffsetDateTime from, int amount) {
        return from.plus(amount, chronoUnit);
    }

    public String describe(int amount) {
        if (amount == 0) {
            return "Immediately";
        }
        return amount + " " + label + (amount > 1 ? "s" : "");
    }
}
