package com.campost.faraid.Entity.Enum;

public enum ShareType {
    FIXED,
    TAASIB,
    MIXED,
    EXCLUDED
}
