package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.util.InheritanceCase;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

@Component
public class UterineSiblingsRule implements InheritanceRule {

    @Override
    public boolean canApply(InheritanceCase c) {
        return c.countUterineSiblings() > 0;
    }

    @Override
    public FixedShareDto calculate(InheritanceCase c) {
        EnumSet<Relationship> uterine = EnumSet.of(Relationship.UTERINE_BROTHER, Relationship.UTERINE_SISTER);
        if (c.countUterineSiblings() == 1) {
            return new FixedShareDto(uterine, ShareType.FIXED, FixedShare.SIXTH,
                    "A single uterine sibling takes 1/6");
        }
        // الذكر والأنثى سواء
        return new FixedShareDto(uterine, ShareType.FIXED, FixedShare.THIRD,
                "Uterine siblings share 1/3 equally regardless of sex");
    }
}
