package com.campost.faraid.util;

import com.campost.faraid.DTOs.NormalizedHeir;
import com.campost.faraid.Entity.Enum.Relationship;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Roster-wide predicates for one calculation. {@link #has} and {@link #count} look at the
 * heirs still in play; the roster counts keep every mapped heir, including those blocked
 * by Hajb, for rules that depend on who exists rather than who inherits.
 */
public class InheritanceCase {
    private final BigDecimal netEstate;
    private final Map<Relationship, Integer> heirs;
    private final Map<Relationship, Integer> roster;

    private InheritanceCase(BigDecimal netEstate, Map<Relationship, Integer> heirs, Map<Relationship, Integer> roster) {
        this.netEstate = netEstate != null ? netEstate : BigDecimal.ZERO;
        this.heirs = Collections.unmodifiableMap(heirs);
        this.roster = Collections.unmodifiableMap(roster);
    }

    public static InheritanceCase ofRoster(BigDecimal netEstate, Collection<NormalizedHeir> roster) {
        Map<Relationship, Integer> counts = countMapped(roster);
        return new InheritanceCase(netEstate, counts, counts);
    }

    public InheritanceCase withActiveHeirs(Collection<NormalizedHeir> active) {
        return new InheritanceCase(netEstate, countMapped(active), roster);
    }

    private static Map<Relationship, Integer> countMapped(Collection<NormalizedHeir> heirs) {
        Map<Relationship, Integer> counts = new EnumMap<>(Relationship.class);
        for (NormalizedHeir heir : heirs) {
            if (!heir.isBarred()) {
                counts.merge(heir.relationship(), 1, Integer::sum);
            }
        }
        return counts;
    }

    // ==================== دوال العد والتحقق ====================
    public int count(Relationship type) {
        return heirs.getOrDefault(type, 0);
    }

    public boolean has(Relationship type) {
        return count(type) > 0;
    }

    public boolean hasDescendant() {
        return has(Relationship.SON) || has(Relationship.DAUGHTER)
                || has(Relationship.GRANDSON)
                || has(Relationship.GRANDDAUGHTER);
    }

    public boolean hasMaleDescendant() {
        return has(Relationship.SON) || has(Relationship.GRANDSON);
    }

    public boolean hasFemaleDescendantOnly() {
        return (has(Relationship.DAUGHTER) || has(Relationship.GRANDDAUGHTER)) &&
                !hasMaleDescendant();
    }

    public boolean hasMaleAscendant() {
        return has(Relationship.FATHER) || has(Relationship.GRANDFATHER);
    }

    public int countUterineSiblings() {
        return count(Relationship.UTERINE_BROTHER) + count(Relationship.UTERINE_SISTER);
    }

    // الإخوة يحجبون الأم حجب نقصان ولو كانوا محجوبين
    public int countRosterSiblings() {
        return roster.entrySet().stream()
                .filter(e -> e.getKey().isSibling())
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    // ==================== دوال الحساب ====================
    public BigDecimal getNetEstate() {
        return netEstate;
    }

    public Map<Relationship, Integer> getHeirs() {
        return heirs;
    }

    @Override
    public String toString() {
        return "InheritanceCase{" +
                "netEstate=" + netEstate +
                ", heirs=" + heirs +
                ", roster=" + roster +
                '}';
    }
}
