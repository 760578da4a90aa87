package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class GranddaughterRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.GRANDDAUGHTER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        if (c.has(Relationship.GRANDSON)) {
            return new FixedShareDto(Relationship.GRANDDAUGHTER, ShareType.TAASIB, null,
                    "Granddaughters share the residue with the grandson, the male taking twice the female");
        }
        int daughters = c.count(Relationship.DAUGHTER);
        if (daughters == 1) {
            // تكملة الثلثين
            return new FixedShareDto(Relationship.GRANDDAUGHTER, ShareType.FIXED, FixedShare.SIXTH,
                    "Granddaughters take 1/6 to complete 2/3 with the single daughter");
        }
        if (daughters > 1) {
            return null;
        }
        if (c.count(Relationship.GRANDDAUGHTER) == 1) {
            return new FixedShareDto(Relationship.GRANDDAUGHTER, ShareType.FIXED, FixedShare.HALF,
                    "A single granddaughter with no daughter or grandson takes 1/2");
        }
        return new FixedShareDto(Relationship.GRANDDAUGHTER, ShareType.FIXED, FixedShare.TWO_THIRDS,
                "Two or more granddaughters with no daughter or grandson share 2/3");
    }
}
