package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed enumeration of where a task came from. Aliases cover the names the watchers
 * used historically ({@code email}, {@code linkedin}, {@code whatsapp}).
 */
public enum SourceTag {
    INBOX("inbox"),
    EXTERNAL_EMAIL("external-email"),
    EXTERNAL_SOCIAL("external-social"),
    BUSINESS_MESSAGING("business-messaging");

    private final String wireName;

    SourceTag(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isExternal() {
        return this == EXTERNAL_EMAIL || this == EXTERNAL_SOCIAL;
    }

    @JsonCreator
    public static SourceTag fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INBOX;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "email", "gmail" -> {
                return EXTERNAL_EMAIL;
            }
            case "linkedin", "social" -> {
                return EXTERNAL_SOCIAL;
            }
            case "whatsapp", "messaging" -> {
                return BUSINESS_MESSAGING;
            }
            default -> {
                for (SourceTag tag : values()) {
                    if (tag.wireName.equals(value) || tag.name().equalsIgnoreCase(value)) {
                        return tag;
                    }
                }
                throw new IllegalArgumentException("Unknown source: " + raw);
            }
        }
    }
}
