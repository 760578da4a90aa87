package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class FatherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.FATHER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        return ascendantShare(c, Relationship.FATHER, "father");
    }

    static FixedShareDto ascendantShare(InheritanceCase c, Relationship relationship, String who) {
        if (c.hasMaleDescendant()) {
            return new FixedShareDto(relationship, ShareType.FIXED, FixedShare.SIXTH,
                    "The " + who + " takes 1/6 only because of a male descendant");
        }
        if (c.hasFemaleDescendantOnly()) {
            return new FixedShareDto(relationship, ShareType.MIXED, FixedShare.SIXTH,
                    "The " + who + " takes 1/6 and the residue because only female descendants exist");
        }
        return new FixedShareDto(relationship, ShareType.TAASIB, null,
                "The " + who + " takes the residue because the deceased left no descendants");
    }
}
