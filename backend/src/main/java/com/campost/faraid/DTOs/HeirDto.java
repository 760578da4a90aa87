package com.campost.faraid.DTOs;

import java.math.BigDecimal;

public record HeirDto(
        Long id,
        String name,
        String relationship,
        String gender,
        String heirGroup,
        BigDecimal portions
) {
    public HeirDto(Long id, String name, String relationship, String gender, String heirGroup) {
        this(id, name, relationship, gender, heirGroup, null);
    }
}
