package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class FullSisterRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.FULL_SISTER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        FixedShareDto residuary = sisterResiduary(c, Relationship.FULL_SISTER, Relationship.FULL_BROTHER, "full");
        if (residuary != null || c.hasMaleAscendant()) {
            return residuary;
        }
        return sisterShare(c, Relationship.FULL_SISTER, "full");
    }

    static FixedShareDto sisterResiduary(InheritanceCase c, Relationship sister, Relationship brother, String kind) {
        if (c.has(brother)) {
            return new FixedShareDto(sister, ShareType.TAASIB, null,
                    "The " + kind + " sisters share the residue with their brothers, the male taking twice the female");
        }
        if (c.hasDescendant()) {
            return new FixedShareDto(sister, ShareType.TAASIB, null,
                    "The " + kind + " sisters take the residue alongside the female descendants");
        }
        return null;
    }

    static FixedShareDto sisterShare(InheritanceCase c, Relationship sister, String kind) {
        if (c.count(sister) == 1) {
            return new FixedShareDto(sister, ShareType.FIXED, FixedShare.HALF,
                    "A single " + kind + " sister takes 1/2");
        }
        return new FixedShareDto(sister, ShareType.FIXED, FixedShare.TWO_THIRDS,
                "Two or more " + kind + " sisters share 2/3");
    }
}
