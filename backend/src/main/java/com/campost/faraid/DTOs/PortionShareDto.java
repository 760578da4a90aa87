package com.campost.faraid.DTOs;

import java.math.BigDecimal;

public record PortionShareDto(
        Long heirId,
        String name,
        String relationship,
        String heirGroup,
        BigDecimal portions,
        BigDecimal shareAmount
) {
}
