package com.campost.faraid.DTOs;

import java.math.BigDecimal;

public record GroupSummaryDto(
        int count,
        BigDecimal totalShare
) {
    public GroupSummaryDto add(BigDecimal share) {
        return new GroupSummaryDto(count + 1, totalShare.add(share));
    }
}
