package com.campost.faraid.DTOs;

import com.campost.faraid.Entity.Enum.Relationship;

/**
 * An input heir with its canonical relationship. {@code position} is the heir's index
 * in the submitted roster and identifies it through the pipeline even when no id was given.
 */
public record NormalizedHeir(
        int position,
        HeirDto heir,
        Relationship relationship,
        boolean unmapped,
        String exclusionReason
) {
    public static NormalizedHeir mapped(int position, HeirDto heir, Relationship relationship) {
        return new NormalizedHeir(position, heir, relationship, false, null);
    }

    public static NormalizedHeir barred(int position, HeirDto heir, String reason) {
        return new NormalizedHeir(position, heir, Relationship.EXCLUDED, false, reason);
    }

    public static NormalizedHeir unmapped(int position, HeirDto heir, String reason) {
        return new NormalizedHeir(position, heir, Relationship.EXCLUDED, true, reason);
    }

    public boolean isBarred() {
        return relationship == Relationship.EXCLUDED;
    }

    public String displayName() {
        String name = heir.name();
        return name == null || name.isBlank() ? relationship.getDisplayName() + " #" + (position + 1) : name;
    }

    public String groupLabel() {
        String group = heir.heirGroup();
        return group == null || group.isBlank() ? relationship.getDisplayName() : group.trim();
    }
}
