package com.campost.faraid.DTOs.request;

import com.campost.faraid.DTOs.HeirDto;

import java.math.BigDecimal;
import java.util.List;

public record InheritanceCalculationRequest(
        BigDecimal estateAmount,
        BigDecimal debts,
        BigDecimal will,
        List<HeirDto> heirs
) {
    public static InheritanceCalculationRequest of(BigDecimal estateAmount, List<HeirDto> heirs) {
        return new InheritanceCalculationRequest(estateAmount, null, null, heirs);
    }
}
