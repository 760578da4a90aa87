package com.campost.faraid.service;

import com.campost.faraid.DTOs.HeirDto;
import com.campost.faraid.DTOs.NormalizedHeir;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.config.FaraidProperties;
import com.campost.faraid.exceptionHandler.InvalidInheritanceCaseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeirNormalizationServiceTest {

    private final FaraidProperties properties = new FaraidProperties();
    private final HeirNormalizationService service = new HeirNormalizationService(properties);

    private NormalizedHeir normalize(String relationship, String gender, String group) {
        return service.normalize(0, new HeirDto(1L, "Heir", relationship, gender, group));
    }

    @Nested
    @DisplayName("explicit labels")
    class ExplicitLabels {

        @ParameterizedTest
        @CsvSource(quoteCharacter = '"', value = {
                "Son, SON",
                "daughters, DAUGHTER",
                "HUSBAND, HUSBAND",
                "FULL_BROTHER, FULL_BROTHER",
                "Paternal Half-Brother, CONSANGUINE_BROTHER",
                "maternal half sister, UTERINE_SISTER",
                "Brother's Son, FULL_NEPHEW",
                "son of son, GRANDSON",
                "Maternal Grandmother, GRANDMOTHER",
                "  Full   Sister , FULL_SISTER"
        })
        void mapsEnglishSynonyms(String label, Relationship expected) {
            NormalizedHeir heir = normalize(label, null, null);

            assertThat(heir.relationship()).isEqualTo(expected);
            assertThat(heir.unmapped()).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "زوجة, WIFE",
                "الأم, MOTHER",
                "بنت الابن, GRANDDAUGHTER",
                "أخ لأم, UTERINE_BROTHER",
                "ابن الأخ الشقيق, FULL_NEPHEW"
        })
        void mapsArabicLabels(String label, Relationship expected) {
            assertThat(normalize(label, null, null).relationship()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("generic labels")
    class GenericLabels {

        @Test
        void childResolvedByHeirGroup() {
            assertThat(normalize("Child", null, "Sons").relationship()).isEqualTo(Relationship.SON);
            assertThat(normalize("Child", null, "Daughters").relationship()).isEqualTo(Relationship.DAUGHTER);
        }

        @Test
        void spouseResolvedByGender() {
            assertThat(normalize("Spouse", "Male", "Family").relationship()).isEqualTo(Relationship.HUSBAND);
            assertThat(normalize("Spouse", "F", null).relationship()).isEqualTo(Relationship.WIFE);
        }

        @Test
        void spouseResolvedByGroupBeforeGender() {
            assertThat(normalize("Spouse", null, "Wives").relationship()).isEqualTo(Relationship.WIFE);
        }

        @Test
        void ambiguousWithoutGenderOrGroupIsUnmapped() {
            NormalizedHeir heir = normalize("Child", null, "Heirs");

            assertThat(heir.relationship()).isEqualTo(Relationship.EXCLUDED);
            assertThat(heir.unmapped()).isTrue();
            assertThat(heir.exclusionReason()).contains("ambiguous");
        }
    }

    @Nested
    @DisplayName("non-heirs")
    class NonHeirs {

        @ParameterizedTest
        @ValueSource(strings = {"Stepson", "Step-Mother", "Adopted Son", "Foster Brother", "Illegitimate Child", "ربيبة"})
        void prohibitedRelationsAreBarred(String label) {
            NormalizedHeir heir = normalize(label, null, null);

            assertThat(heir.relationship()).isEqualTo(Relationship.EXCLUDED);
            assertThat(heir.unmapped()).isFalse();
            assertThat(heir.exclusionReason()).contains("does not inherit");
        }

        @ParameterizedTest
        @ValueSource(strings = {"Maternal Grandfather", "Daughter's Son", "Aunt", "Maternal Uncle", "Sister's Daughter", "Niece", "خالة"})
        void distantKindredAreBarred(String label) {
            NormalizedHeir heir = normalize(label, null, null);

            assertThat(heir.relationship()).isEqualTo(Relationship.EXCLUDED);
            assertThat(heir.unmapped()).isFalse();
            assertThat(heir.exclusionReason()).contains("distant kindred");
        }

        @Test
        void unknownLabelIsFlaggedAsUnmapped() {
            NormalizedHeir heir = normalize("Cousin", "Male", null);

            assertThat(heir.relationship()).isEqualTo(Relationship.EXCLUDED);
            assertThat(heir.unmapped()).isTrue();
            assertThat(heir.exclusionReason()).contains("Unrecognised relationship 'Cousin'");
        }

        @Test
        void missingLabelIsFlaggedAsUnmapped() {
            assertThat(normalize(null, null, null).unmapped()).isTrue();
            assertThat(normalize("  ", null, null).unmapped()).isTrue();
        }

        @Test
        void strictModeRejectsUnmappedLabels() {
            properties.setRejectUnmappedRelationships(true);

            assertThatThrownBy(() -> service.normalize(List.of(new HeirDto(1L, "X", "Cousin", null, null))))
                    .isInstanceOf(InvalidInheritanceCaseException.class)
                    .hasMessageContaining("Cousin");
        }
    }

    @Test
    void keepsRosterPositions() {
        List<NormalizedHeir> heirs = service.normalize(List.of(
                new HeirDto(10L, "A", "Son", null, "Sons"),
                new HeirDto(11L, "B", "Wife", null, "Wives")));

        assertThat(heirs).extracting(NormalizedHeir::position).containsExactly(0, 1);
        assertThat(heirs).extracting(NormalizedHeir::relationship).containsExactly(Relationship.SON, Relationship.WIFE);
    }
}
