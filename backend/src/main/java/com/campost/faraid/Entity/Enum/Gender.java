package com.campost.faraid.Entity.Enum;

import java.util.Locale;

public enum Gender {
    MALE,
    FEMALE,
    UNKNOWN;

    public static Gender parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "m", "male", "man", "boy", "ذكر" -> MALE;
            case "f", "female", "woman", "girl", "أنثى", "انثى" -> FEMALE;
            default -> UNKNOWN;
        };
    }
}
