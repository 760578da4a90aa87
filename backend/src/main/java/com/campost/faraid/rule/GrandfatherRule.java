package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class GrandfatherRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.GRANDFATHER) && !c.has(Relationship.FATHER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        return FatherRule.ascendantShare(c, Relationship.GRANDFATHER, "grandfather");
    }
}
