package com.campost.faraid.DTOs.response;

import com.campost.faraid.DTOs.GroupSummaryDto;
import com.campost.faraid.DTOs.ShareResultDto;
import com.campost.faraid.Entity.Enum.CalculationCase;
import com.campost.faraid.util.BigFractionSerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record CalculationResult(
        BigDecimal estateAmount,
        int baseNumber,
        @JsonSerialize(using = BigFractionSerializer.class) BigFraction totalParts,
        @JsonProperty("case") CalculationCase calculationCase,
        List<String> notes,
        List<ShareResultDto> heirs,
        Map<String, GroupSummaryDto> groupSummary,
        List<Long> unmappedHeirIds,
        BigDecimal difference
) {
    public static CalculationResult empty(BigDecimal estateAmount, int baseNumber, List<String> notes) {
        return new CalculationResult(
                estateAmount,
                baseNumber,
                BigFraction.ZERO,
                CalculationCase.STANDARD,
                List.copyOf(notes),
                List.of(),
                Map.of(),
                List.of(),
                estateAmount
        );
    }

    public BigDecimal totalDistributed() {
        return heirs.stream()
                .map(ShareResultDto::shareAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
