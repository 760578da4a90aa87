package com.campost.faraid.DTOs.response;

import com.campost.faraid.DTOs.GroupSummaryDto;
import com.campost.faraid.DTOs.PortionShareDto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record PortionsDistributionResult(
        BigDecimal inheritanceAmount,
        BigDecimal totalPortions,
        BigDecimal sharePerPortion,
        List<PortionShareDto> heirs,
        Map<String, GroupSummaryDto> groupSummary
) {
}
