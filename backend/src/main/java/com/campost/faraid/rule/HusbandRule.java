package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class HusbandRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.HUSBAND);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        if (c.hasDescendant()) {
            return new FixedShareDto(Relationship.HUSBAND, ShareType.FIXED, FixedShare.QUARTER,
                    "The husband takes 1/4 because the deceased left descendants");
        }
        return new FixedShareDto(Relationship.HUSBAND, ShareType.FIXED, FixedShare.HALF,
                "The husband takes 1/2 because the deceased left no descendants");
    }
}
