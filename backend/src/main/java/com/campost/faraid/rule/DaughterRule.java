package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class DaughterRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.DAUGHTER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        if (c.has(Relationship.SON)) {
            // مع وجود ابن: تعصيب بالغير
            return new FixedShareDto(Relationship.DAUGHTER, ShareType.TAASIB, null,
                    "Daughters share the residue with their brothers, the male taking twice the female");
        }
        if (c.count(Relationship.DAUGHTER) == 1) {
            return new FixedShareDto(Relationship.DAUGHTER, ShareType.FIXED, FixedShare.HALF,
                    "A single daughter with no son takes 1/2");
        }
        return new FixedShareDto(Relationship.DAUGHTER, ShareType.FIXED, FixedShare.TWO_THIRDS,
                "Two or more daughters with no son share 2/3");
    }
}
