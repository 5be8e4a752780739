package io.mnemo.core.repair;

import java.util.Locale;

/**
 * Repair passes, cheapest first.
 */
public enum RepairPass {
    DIRECT,
    STRIP_PROSE,
    BALANCE,
    LEGACY_ADAPT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
