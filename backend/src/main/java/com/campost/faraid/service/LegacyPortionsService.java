package com.campost.faraid.service;

import com.campost.faraid.DTOs.GroupSummaryDto;
import com.campost.faraid.DTOs.HeirDto;
import com.campost.faraid.DTOs.PortionShareDto;
import com.campost.faraid.DTOs.response.PortionsDistributionResult;
import com.campost.faraid.config.FaraidProperties;
import com.campost.faraid.exceptionHandler.InvalidInheritanceCaseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;

/**
 * Splits an amount by the fixed portion weights stored on each heir record. This is the
 * ledger's historical split and is kept for comparison with the Fara'id calculation; it
 * applies no inheritance rules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegacyPortionsService {

    private static final BigDecimal DEFAULT_TOTAL_PORTIONS = BigDecimal.valueOf(24);
    private static final int PORTION_PRECISION = 10;

    private static final Comparator<HeirDto> LEDGER_ORDER = Comparator
            .comparing((HeirDto h) -> Objects.toString(h.heirGroup(), ""))
            .thenComparing(h -> Objects.toString(h.name(), ""));

    private final FaraidProperties properties;

    public PortionsDistributionResult distribute(BigDecimal inheritanceAmount, List<HeirDto> heirs) {
        if (inheritanceAmount == null || inheritanceAmount.signum() < 0) {
            throw new InvalidInheritanceCaseException("Inheritance amount must be zero or positive");
        }
        List<HeirDto> ordered = new ArrayList<>(heirs != null ? heirs : List.of());
        ordered.sort(LEDGER_ORDER);

        BigDecimal totalPortions = ordered.stream()
                .map(this::portionsOf)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalPortions.signum() == 0) {
            totalPortions = DEFAULT_TOTAL_PORTIONS;
        }

        BigDecimal sharePerPortion = inheritanceAmount.signum() > 0
                ? inheritanceAmount.divide(totalPortions, PORTION_PRECISION, properties.getRoundingMode())
                : BigDecimal.ZERO;

        List<PortionShareDto> shares = new ArrayList<>(ordered.size());
        Map<String, GroupSummaryDto> groupSummary = new TreeMap<>();
        for (HeirDto heir : ordered) {
            BigDecimal amount = sharePerPortion.multiply(portionsOf(heir))
                    .setScale(properties.getCurrencyScale(), properties.getRoundingMode());
            shares.add(new PortionShareDto(heir.id(), heir.name(), heir.relationship(), heir.heirGroup(),
                    portionsOf(heir), amount));
            groupSummary.merge(Objects.toString(heir.heirGroup(), ""), new GroupSummaryDto(1, amount),
                    (a, b) -> a.add(b.totalShare()));
        }

        log.debug("Split {} over {} portions ({} per portion)", inheritanceAmount, totalPortions, sharePerPortion);
        return new PortionsDistributionResult(
                inheritanceAmount,
                totalPortions,
                sharePerPortion.setScale(properties.getCurrencyScale(), properties.getRoundingMode()),
                List.copyOf(shares),
                Collections.unmodifiableMap(groupSummary)
        );
    }

    private BigDecimal portionsOf(HeirDto heir) {
        return heir.portions() != null ? heir.portions() : BigDecimal.ZERO;
    }
}
