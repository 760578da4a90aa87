package com.campost.faraid.Entity.Enum;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum AsabaType {
    BY_SELF("in their own right", "عصبة بالنفس"),
    WITH_OTHER("through a brother", "عصبة بالغير"),
    WITH_ANOTHER("alongside the female descendants", "عصبة مع الغير"),
    NONE("not as a residuary", "ليس بعاصب");

    private final String description;
    private final String arabicName;

    public String describe() {
        return description + " (" + arabicName + ")";
    }
}
