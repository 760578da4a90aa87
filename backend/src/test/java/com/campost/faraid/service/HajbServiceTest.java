package com.campost.faraid.service;

import com.campost.faraid.DTOs.ExclusionResult;
import com.campost.faraid.DTOs.HeirDto;
import com.campost.faraid.DTOs.NormalizedHeir;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.util.InheritanceCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.campost.faraid.Entity.Enum.Relationship.*;
import static org.assertj.core.api.Assertions.assertThat;

class HajbServiceTest {

    private final HajbService hajbService = new HajbService();

    private static List<NormalizedHeir> roster(Relationship... relationships) {
        List<NormalizedHeir> roster = new ArrayList<>();
        for (int i = 0; i < relationships.length; i++) {
            HeirDto dto = new HeirDto((long) i + 1, relationships[i].getDisplayName() + " " + (i + 1),
                    relationships[i].name(), null, null);
            roster.add(NormalizedHeir.mapped(i, dto, relationships[i]));
        }
        return roster;
    }

    private ExclusionResult resolve(List<NormalizedHeir> roster) {
        return hajbService.resolve(roster, InheritanceCase.ofRoster(BigDecimal.TEN, roster));
    }

    private List<Relationship> excludedRelationships(Relationship... relationships) {
        List<NormalizedHeir> roster = roster(relationships);
        ExclusionResult result = resolve(roster);
        return roster.stream()
                .filter(result::isExcluded)
                .map(NormalizedHeir::relationship)
                .toList();
    }

    @Nested
    @DisplayName("descendants")
    class Descendants {

        @Test
        void sonBlocksGrandchildren() {
            assertThat(excludedRelationships(SON, GRANDSON, GRANDDAUGHTER))
                    .containsExactly(GRANDSON, GRANDDAUGHTER);
        }

        @Test
        void twoDaughtersBlockGranddaughterWithoutGrandson() {
            assertThat(excludedRelationships(DAUGHTER, DAUGHTER, GRANDDAUGHTER)).containsExactly(GRANDDAUGHTER);
        }

        @Test
        void grandsonKeepsGranddaughterInPlay() {
            assertThat(excludedRelationships(DAUGHTER, DAUGHTER, GRANDDAUGHTER, GRANDSON)).isEmpty();
        }

        @Test
        void singleDaughterDoesNotBlockGranddaughter() {
            assertThat(excludedRelationships(DAUGHTER, GRANDDAUGHTER)).isEmpty();
        }
    }

    @Nested
    @DisplayName("ascendants")
    class Ascendants {

        @Test
        void fatherBlocksGrandfatherAndEverySibling() {
            assertThat(excludedRelationships(FATHER, GRANDFATHER, FULL_BROTHER, FULL_SISTER, CONSANGUINE_BROTHER,
                    CONSANGUINE_SISTER, UTERINE_BROTHER, UTERINE_SISTER, FULL_NEPHEW))
                    .containsExactly(GRANDFATHER, FULL_BROTHER, FULL_SISTER, CONSANGUINE_BROTHER,
                            CONSANGUINE_SISTER, UTERINE_BROTHER, UTERINE_SISTER, FULL_NEPHEW);
        }

        @Test
        void motherBlocksGrandmother() {
            assertThat(excludedRelationships(MOTHER, GRANDMOTHER)).containsExactly(GRANDMOTHER);
        }

        @Test
        void grandfatherBlocksUterineSiblingsAndNephewOnly() {
            assertThat(excludedRelationships(GRANDFATHER, FULL_BROTHER, UTERINE_SISTER, FULL_NEPHEW))
                    .containsExactly(UTERINE_SISTER, FULL_NEPHEW);
        }
    }

    @Nested
    @DisplayName("siblings")
    class Siblings {

        @Test
        void fullBrotherBlocksConsanguineSiblingsAndNephew() {
            assertThat(excludedRelationships(FULL_BROTHER, CONSANGUINE_BROTHER, CONSANGUINE_SISTER, FULL_NEPHEW))
                    .containsExactly(CONSANGUINE_BROTHER, CONSANGUINE_SISTER, FULL_NEPHEW);
        }

        @Test
        void twoFullSistersBlockConsanguineSister() {
            assertThat(excludedRelationships(FULL_SISTER, FULL_SISTER, CONSANGUINE_SISTER))
                    .containsExactly(CONSANGUINE_SISTER);
        }

        @Test
        void consanguineBrotherProtectsHisSister() {
            assertThat(excludedRelationships(FULL_SISTER, FULL_SISTER, CONSANGUINE_SISTER, CONSANGUINE_BROTHER))
                    .isEmpty();
        }

        @Test
        void daughterBlocksUterineButNotFullSiblings() {
            assertThat(excludedRelationships(DAUGHTER, FULL_BROTHER, UTERINE_BROTHER))
                    .containsExactly(UTERINE_BROTHER);
        }

        @Test
        void grandsonBlocksAllSiblings() {
            assertThat(excludedRelationships(GRANDSON, FULL_SISTER, CONSANGUINE_BROTHER, UTERINE_SISTER))
                    .containsExactly(FULL_SISTER, CONSANGUINE_BROTHER, UTERINE_SISTER);
        }
    }

    @Test
    void notesNameTheBlockingRelative() {
        ExclusionResult result = resolve(roster(SON, GRANDSON));

        assertThat(result.notes()).containsExactly("Grandson 2 (Grandson) is excluded by the Son");
        assertThat(result.excluded()).containsEntry(1, "the Son");
        assertThat(result.activeHeirs()).extracting(NormalizedHeir::relationship).containsExactly(SON);
    }

    @Test
    void barredHeirsAreAlwaysExcluded() {
        List<NormalizedHeir> roster = new ArrayList<>(roster(SON));
        roster.add(NormalizedHeir.barred(1, new HeirDto(2L, "Sami", "Stepson", null, null), "a step relation"));

        ExclusionResult result = resolve(roster);

        assertThat(result.excluded()).containsOnlyKeys(1);
        assertThat(result.notes()).containsExactly("Sami is excluded: a step relation");
    }

    @Test
    void blockedSiblingsStillCountInTheRoster() {
        List<NormalizedHeir> roster = roster(FATHER, MOTHER, FULL_BROTHER, FULL_BROTHER);
        InheritanceCase rosterCase = InheritanceCase.ofRoster(BigDecimal.TEN, roster);
        ExclusionResult result = hajbService.resolve(roster, rosterCase);

        InheritanceCase active = rosterCase.withActiveHeirs(result.activeHeirs());

        assertThat(active.has(FULL_BROTHER)).isFalse();
        assertThat(active.countRosterSiblings()).isEqualTo(2);
    }
}
