package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class WifeRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.WIFE);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        FixedShare share = c.hasDescendant() ? FixedShare.EIGHTH : FixedShare.QUARTER;
        String reason = c.count(Relationship.WIFE) > 1
                ? "The wives share " + share.getLabel() + " equally"
                : "The wife takes " + share.getLabel();
        return new FixedShareDto(Relationship.WIFE, ShareType.FIXED, share,
                reason + (c.hasDescendant() ? " because the deceased left descendants" : " because the deceased left no descendants"));
    }
}
