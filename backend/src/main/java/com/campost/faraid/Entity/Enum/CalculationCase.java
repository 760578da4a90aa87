package com.campost.faraid.Entity.Enum;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CalculationCase {
    STANDARD("Standard"),
    AWL("Awl"),
    RADD("Radd");

    @JsonValue
    private final String label;
}
