package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class MotherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.MOTHER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        // ====== السدس ======
        if (c.hasDescendant()) {
            return new FixedShareDto(Relationship.MOTHER, ShareType.FIXED, FixedShare.SIXTH,
                    "The mother takes 1/6 because the deceased left descendants");
        }
        if (c.countRosterSiblings() >= 2) {
            return new FixedShareDto(Relationship.MOTHER, ShareType.FIXED, FixedShare.SIXTH,
                    "The mother takes 1/6 because the deceased left two or more siblings");
        }
        // ====== الثلث ======
        return new FixedShareDto(Relationship.MOTHER, ShareType.FIXED, FixedShare.THIRD,
                "The mother takes 1/3 because there are no descendants and fewer than two siblings");
    }
}
