package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

@Component
public class ConsanguineSisterRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.has(Relationship.CONSANGUINE_SISTER);
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        FixedShareDto residuary = FullSisterRule.sisterResiduary(
                c, Relationship.CONSANGUINE_SISTER, Relationship.CONSANGUINE_BROTHER, "consanguine");
        if (residuary != null || c.hasMaleAscendant()) {
            return residuary;
        }
        int fullSisters = c.count(Relationship.FULL_SISTER);
        if (fullSisters == 1) {
            return new FixedShareDto(Relationship.CONSANGUINE_SISTER, ShareType.FIXED, FixedShare.SIXTH,
                    "Consanguine sisters take 1/6 to complete 2/3 with the single full sister");
        }
        if (fullSisters > 1) {
            return null;
        }
        return FullSisterRule.sisterShare(c, Relationship.CONSANGUINE_SISTER, "consanguine");
    }
}
