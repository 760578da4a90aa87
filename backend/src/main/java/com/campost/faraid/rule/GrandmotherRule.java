package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class GrandmotherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.GRANDMOTHER) && !c.has(Relationship.MOTHER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        String reason = c.count(Relationship.GRANDMOTHER) > 1
                ? "The grandmothers share 1/6 equally"
                : "The grandmother takes 1/6";
        return new FixedShareDto(Relationship.GRANDMOTHER, ShareType.FIXED, FixedShare.SIXTH, reason);
    }
}
