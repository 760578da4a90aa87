package com.campost.faraid.service;

import com.campost.faraid.DTOs.*;
import com.campost.faraid.DTOs.request.InheritanceCalculationRequest;
import com.campost.faraid.DTOs.response.CalculationResult;
import com.campost.faraid.Entity.Enum.*;
import com.campost.faraid.config.FaraidProperties;
import com.campost.faraid.exceptionHandler.InvalidInheritanceCaseException;
import com.campost.faraid.rule.InheritanceRule;
import com.campost.faraid.util.InheritanceCase;
import com.campost.faraid.util.Parts;
import com.campost.faraid.util.ShareAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.fraction.BigFraction;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

import static com.campost.faraid.Entity.Enum.Relationship.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class InheritanceCalculationService {

    // ترتيب العصبات
    private static final List<List<Relationship>> ASABA_PRIORITY = List.of(
            List.of(SON, DAUGHTER),
            List.of(GRANDSON, GRANDDAUGHTER),
            List.of(FATHER),
            List.of(GRANDFATHER),
            List.of(FULL_BROTHER, FULL_SISTER),
            List.of(CONSANGUINE_BROTHER, CONSANGUINE_SISTER),
            List.of(FULL_NEPHEW)
    );

    private final List<InheritanceRule> rules;
    private final HeirNormalizationService normalizationService;
    private final HajbService hajbService;
    private final FaraidProperties properties;

    public CalculationResult calculate(InheritanceCalculationRequest request) {
        validateRequest(request);

        BigDecimal netEstate = netEstate(request);
        List<HeirDto> heirs = request.heirs() != null ? request.heirs() : List.of();
        if (heirs.isEmpty()) {
            log.info("No heirs supplied; nothing to distribute from {}", netEstate);
            return CalculationResult.empty(netEstate, FixedShare.BASE, List.of("No heirs were supplied"));
        }

        // ====== تصنيف الورثة ======
        List<NormalizedHeir> roster = normalizationService.normalize(heirs);
        validateRoster(roster);
        InheritanceCase rosterCase = InheritanceCase.ofRoster(netEstate, roster);
        logCaseInfo(rosterCase);

        // ====== الحجب ======
        ExclusionResult hajb = hajbService.resolve(roster, rosterCase);
        List<NormalizedHeir> active = hajb.activeHeirs();
        InheritanceCase c = rosterCase.withActiveHeirs(active);
        List<String> notes = new ArrayList<>(hajb.notes());

        // ====== الفروض ======
        Map<Integer, BigFraction> parts = new LinkedHashMap<>();
        Map<Integer, FixedShareDto> shares = new HashMap<>();
        Map<Integer, Integer> poolSizes = new HashMap<>();
        distributeFixedShares(c, active, parts, shares, poolSizes);

        // ====== العصبات ======
        BigFraction residue = Parts.BASE.subtract(Parts.sum(parts.values()));
        List<NormalizedHeir> asaba = findAsabaGroup(c, active);
        Set<Integer> residuaries = new HashSet<>();
        if (Parts.signum(residue) > 0 && !asaba.isEmpty()) {
            distributeAsaba(asaba, residue, parts, residuaries, notes);
        }

        // ====== العول والرد ======
        BigFraction total = Parts.sum(parts.values());
        BigFraction base = Parts.BASE;
        CalculationCase calculationCase = CalculationCase.STANDARD;
        Set<Integer> raddReceivers = new HashSet<>();
        if (total.compareTo(Parts.BASE) > 0) {
            calculationCase = CalculationCase.AWL;
            base = total;
            notes.add("Awl: the shares total " + Parts.format(total) + "/24, so the base is raised to " + Parts.format(total)
                    + " and every share is reduced in proportion");
        } else if (total.compareTo(Parts.BASE) < 0 && asaba.isEmpty() && Parts.signum(total) > 0) {
            calculationCase = CalculationCase.RADD;
            applyRadd(active, parts, Parts.BASE.subtract(total), raddReceivers, notes);
            total = Parts.sum(parts.values());
        } else if (Parts.isZero(total)) {
            notes.add("No heir is entitled to inherit; the estate remains undistributed");
        }

        List<ShareResultDto> results = convertToAmounts(
                c, roster, hajb, parts, shares, poolSizes, residuaries, raddReceivers, asaba, base, netEstate, notes);
        results = adjustForRoundingErrors(results, netEstate);

        CalculationResult result = createResponse(netEstate, base, total, calculationCase, notes, results, roster);
        log.info("Calculated {} heirs ({} active): case={}, base={}, distributed={} of {}",
                roster.size(), active.size(), calculationCase.getLabel(), result.baseNumber(),
                result.totalDistributed(), netEstate);
        return result;
    }

    private void distributeFixedShares(
            InheritanceCase c,
            List<NormalizedHeir> active,
            Map<Integer, BigFraction> parts,
            Map<Integer, FixedShareDto> shares,
            Map<Integer, Integer> poolSizes
    ) {
        for (InheritanceRule rule : rules) {
            if (!rule.canApply(c)) {
                continue;
            }
            FixedShareDto dto = rule.calculate(c);
            if (dto == null) {
                continue;
            }
            List<NormalizedHeir> members = active.stream()
                    .filter(h -> dto.relationships().contains(h.relationship()))
                    .toList();
            members.forEach(h -> {
                shares.put(h.position(), dto);
                poolSizes.put(h.position(), members.size());
            });
            if (dto.hasFixedShare()) {
                ShareAllocator.equally(dto.fixedShare().getParts(), members)
                        .forEach((h, share) -> parts.merge(h.position(), share, BigFraction::add));
            }
        }
    }

    List<NormalizedHeir> findAsabaGroup(InheritanceCase c, List<NormalizedHeir> active) {
        for (List<Relationship> group : ASABA_PRIORITY) {
            List<NormalizedHeir> members = active.stream()
                    .filter(h -> group.contains(h.relationship()))
                    .filter(h -> h.relationship().canBeAsaba(c))
                    .toList();
            if (!members.isEmpty()) {
                return members;
            }
        }
        return List.of();
    }

    private void distributeAsaba(
            List<NormalizedHeir> asaba,
            BigFraction residue,
            Map<Integer, BigFraction> parts,
            Set<Integer> residuaries,
            List<String> notes
    ) {
        ShareAllocator.byWeight(residue, asaba, h -> h.relationship().getAsabaUnit())
                .forEach((h, share) -> {
                    parts.merge(h.position(), share, BigFraction::add);
                    residuaries.add(h.position());
                });
        notes.add("Residue of " + Parts.format(residue) + "/24 goes to " + describe(asaba)
                + (asaba.stream().map(NormalizedHeir::relationship).distinct().count() > 1
                ? ", the male taking twice the female" : ""));
    }

    private void applyRadd(
            List<NormalizedHeir> active,
            Map<Integer, BigFraction> parts,
            BigFraction shortfall,
            Set<Integer> raddReceivers,
            List<String> notes
    ) {
        List<NormalizedHeir> eligible = active.stream()
                .filter(h -> !h.relationship().isSpouse())
                .filter(h -> Parts.signum(parts.getOrDefault(h.position(), BigFraction.ZERO)) > 0)
                .toList();
        if (eligible.isEmpty()) {
            // لا يوجد غير الزوج/الزوجة: يرد عليه الباقي
            eligible = active.stream()
                    .filter(h -> Parts.signum(parts.getOrDefault(h.position(), BigFraction.ZERO)) > 0)
                    .toList();
        }
        Map<NormalizedHeir, BigFraction> additions = ShareAllocator.byFractionWeight(
                shortfall, eligible, h -> parts.get(h.position()));
        additions.forEach((h, extra) -> {
            parts.merge(h.position(), extra, BigFraction::add);
            raddReceivers.add(h.position());
        });
        notes.add("Radd: the unclaimed " + Parts.format(shortfall) + "/24 is returned to " + describe(eligible)
                + " in proportion to their shares");
    }

    private List<ShareResultDto> convertToAmounts(
            InheritanceCase c,
            List<NormalizedHeir> roster,
            ExclusionResult hajb,
            Map<Integer, BigFraction> parts,
            Map<Integer, FixedShareDto> shares,
            Map<Integer, Integer> poolSizes,
            Set<Integer> residuaries,
            Set<Integer> raddReceivers,
            List<NormalizedHeir> asaba,
            BigFraction base,
            BigDecimal netEstate,
            List<String> notes
    ) {
        List<ShareResultDto> results = new ArrayList<>(roster.size());
        for (NormalizedHeir heir : roster) {
            int position = heir.position();
            if (hajb.isExcluded(heir)) {
                results.add(excluded(heir, hajb.excluded().get(position), heir.isBarred()));
                continue;
            }

            BigFraction share = parts.getOrDefault(position, BigFraction.ZERO);
            FixedShareDto dto = shares.get(position);
            if (Parts.isZero(share)) {
                String reason = asaba.isEmpty() || asaba.stream().anyMatch(a -> a.relationship() == heir.relationship())
                        ? "nothing remains after the fixed shares"
                        : "the residue goes to " + describe(asaba);
                notes.add(heir.displayName() + " (" + heir.relationship().getDisplayName() + ") takes nothing: " + reason);
                results.add(excluded(heir, reason, false));
                continue;
            }

            boolean fixed = dto != null && dto.hasFixedShare();
            boolean residuary = residuaries.contains(position);
            StringBuilder label = new StringBuilder();
            if (fixed) {
                label.append(dto.fixedShare().getLabel());
                if (poolSizes.getOrDefault(position, 1) > 1) {
                    label.append(" (shared)");
                }
            }
            if (residuary) {
                label.append(fixed ? " + Residue" : "Residue");
            }
            if (raddReceivers.contains(position)) {
                label.append(" + Radd");
            }

            ShareType shareType = fixed && residuary ? ShareType.MIXED : fixed ? ShareType.FIXED : ShareType.TAASIB;
            String reason = dto != null ? dto.reason()
                    : "The " + heir.relationship().getDisplayName().toLowerCase(Locale.ROOT)
                    + " takes the residue " + heir.relationship().getAsabaType(c).describe();

            BigFraction ratio = share.divide(base);
            results.add(new ShareResultDto(
                    heir.heir().id(),
                    heir.displayName(),
                    heir.groupLabel(),
                    heir.relationship(),
                    label.toString(),
                    shareType,
                    share,
                    Parts.toBigDecimal(share, properties.getPartsScale(), properties.getRoundingMode()),
                    Parts.toBigDecimal(ratio.multiply(100), properties.getPercentageScale(), properties.getRoundingMode()),
                    amountOf(netEstate, ratio),
                    reason
            ));
        }
        return results;
    }

    private ShareResultDto excluded(NormalizedHeir heir, String reason, boolean barred) {
        return new ShareResultDto(
                heir.heir().id(),
                heir.displayName(),
                heir.groupLabel(),
                heir.relationship(),
                "Excluded",
                ShareType.EXCLUDED,
                BigFraction.ZERO,
                BigDecimal.ZERO.setScale(properties.getPartsScale()),
                BigDecimal.ZERO.setScale(properties.getPercentageScale()),
                BigDecimal.ZERO.setScale(properties.getCurrencyScale()),
                barred ? reason : "Excluded: " + reason
        );
    }

    private BigDecimal amountOf(BigDecimal netEstate, BigFraction ratio) {
        return netEstate
                .multiply(new BigDecimal(ratio.getNumerator()))
                .divide(new BigDecimal(ratio.getDenominator()), properties.getCurrencyScale(), properties.getRoundingMode());
    }

    private List<ShareResultDto> adjustForRoundingErrors(List<ShareResultDto> results, BigDecimal netEstate) {
        // تصحيح أخطاء التقريب: يضاف الفرق إلى أكبر نصيب
        BigDecimal distributed = results.stream()
                .map(ShareResultDto::shareAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal difference = netEstate
                .setScale(properties.getCurrencyScale(), properties.getRoundingMode())
                .subtract(distributed);
        if (difference.signum() == 0) {
            return results;
        }

        int largest = -1;
        for (int i = 0; i < results.size(); i++) {
            ShareResultDto r = results.get(i);
            if (Parts.signum(r.exactParts()) > 0
                    && (largest < 0 || r.exactParts().compareTo(results.get(largest).exactParts()) > 0)) {
                largest = i;
            }
        }
        if (largest < 0) {
            return results;
        }

        List<ShareResultDto> adjusted = new ArrayList<>(results);
        ShareResultDto target = adjusted.get(largest);
        adjusted.set(largest, target.withShareAmount(target.shareAmount().add(difference)));
        log.debug("Rounding difference {} assigned to {}", difference, target.name());
        return adjusted;
    }

    private CalculationResult createResponse(
            BigDecimal netEstate,
            BigFraction base,
            BigFraction total,
            CalculationCase calculationCase,
            List<String> notes,
            List<ShareResultDto> results,
            List<NormalizedHeir> roster
    ) {
        Map<String, GroupSummaryDto> groupSummary = new TreeMap<>();
        for (ShareResultDto r : results) {
            groupSummary.merge(r.heirGroup(), new GroupSummaryDto(1, r.shareAmount()),
                    (a, b) -> a.add(b.totalShare()));
        }

        List<Long> unmapped = roster.stream()
                .filter(NormalizedHeir::unmapped)
                .map(h -> h.heir().id())
                .filter(Objects::nonNull)
                .toList();

        BigDecimal distributed = results.stream()
                .map(ShareResultDto::shareAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new CalculationResult(
                netEstate,
                Parts.toIntExact(base),
                total,
                calculationCase,
                List.copyOf(notes),
                List.copyOf(results),
                Collections.unmodifiableMap(groupSummary),
                unmapped,
                netEstate.subtract(distributed)
        );
    }

    // ==================== دوال مساعدة ====================

    private static String describe(List<NormalizedHeir> heirs) {
        return heirs.stream()
                .map(h -> h.relationship().getDisplayName())
                .distinct()
                .collect(Collectors.joining(" and ", "the ", ""));
    }

    private BigDecimal netEstate(InheritanceCalculationRequest request) {
        BigDecimal debts = request.debts() != null ? request.debts() : BigDecimal.ZERO;
        BigDecimal will = request.will() != null ? request.will() : BigDecimal.ZERO;
        BigDecimal net = request.estateAmount().subtract(debts).subtract(will);
        return net.signum() > 0 ? net : BigDecimal.ZERO;
    }

    private void validateRequest(InheritanceCalculationRequest request) {
        if (request == null) {
            throw new InvalidInheritanceCaseException("Request must not be null");
        }
        if (request.estateAmount() == null) {
            throw new InvalidInheritanceCaseException("Estate amount must not be null");
        }
        if (request.estateAmount().signum() < 0) {
            throw new InvalidInheritanceCaseException("Estate amount must not be negative");
        }
        if (request.debts() != null && request.debts().signum() < 0) {
            throw new InvalidInheritanceCaseException("Debts must not be negative");
        }
        if (request.will() != null && request.will().signum() < 0) {
            throw new InvalidInheritanceCaseException("Bequest must not be negative");
        }
    }

    private void validateRoster(List<NormalizedHeir> roster) {
        Set<Long> ids = new HashSet<>();
        Map<Relationship, Integer> counts = new EnumMap<>(Relationship.class);
        for (NormalizedHeir heir : roster) {
            Long id = heir.heir().id();
            if (id != null && !ids.add(id)) {
                throw new InvalidInheritanceCaseException("Heir id " + id + " appears more than once");
            }
            counts.merge(heir.relationship(), 1, Integer::sum);
        }
        counts.forEach((relationship, count) -> {
            Integer max = relationship.getMaxAllowed();
            if (max != null && count > max) {
                throw new InvalidInheritanceCaseException(
                        "At most " + max + " " + relationship.getDisplayName() + " allowed, got " + count);
            }
        });
        if (counts.containsKey(HUSBAND) && counts.containsKey(WIFE)) {
            throw new InvalidInheritanceCaseException("A roster cannot contain both a husband and a wife");
        }
    }

    private void logCaseInfo(InheritanceCase c) {
        if (log.isDebugEnabled()) {
            log.debug("=== Case info ===");
            log.debug("Heirs by relationship: {}", c.getHeirs());
            log.debug("Has descendant: {}, male descendant: {}", c.hasDescendant(), c.hasMaleDescendant());
            log.debug("Siblings in roster: {}", c.countRosterSiblings());
            log.debug("Net estate: {}", c.getNetEstate());
        }
    }
}
