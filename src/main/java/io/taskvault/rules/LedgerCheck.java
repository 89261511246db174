package io.taskvault.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Read-only cross-checks a rule may ask for before a plan is written.
 */
public enum LedgerCheck {
    INVOICE("invoice"),
    BANK_BALANCE("bank_balance"),
    CONTACT_HISTORY("contact_history");

    private final String wireName;

    LedgerCheck(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static LedgerCheck fromString(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (LedgerCheck check : values()) {
            if (check.wireName.equals(value)) {
                return check;
            }
        }
        throw new IllegalArgumentException("Unknown ledger check: " + raw);
    }
}
