package com.campost.faraid.DTOs;

import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.Entity.Enum.ShareType;
import com.campost.faraid.util.BigFractionSerializer;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;

public record ShareResultDto(
        Long heirId,
        String name,
        String heirGroup,
        Relationship relationship,
        String fractionLabel,
        ShareType shareType,
        @JsonSerialize(using = BigFractionSerializer.class) BigFraction exactParts,
        BigDecimal parts,
        BigDecimal percentage,
        BigDecimal shareAmount,
        String reason
) {
    public boolean isExcluded() {
        return shareType == ShareType.EXCLUDED;
    }

    public ShareResultDto withShareAmount(BigDecimal amount) {
        return new ShareResultDto(heirId, name, heirGroup, relationship, fractionLabel, shareType,
                exactParts, parts, percentage, amount, reason);
    }
}
