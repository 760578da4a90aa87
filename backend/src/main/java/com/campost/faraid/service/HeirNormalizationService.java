package com.campost.faraid.service;

import com.campost.faraid.DTOs.HeirDto;
import com.campost.faraid.DTOs.NormalizedHeir;
import com.campost.faraid.Entity.Enum.Gender;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.config.FaraidProperties;
import com.campost.faraid.exceptionHandler.InvalidInheritanceCaseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.ar.ArabicNormalizer;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

import static com.campost.faraid.Entity.Enum.Relationship.*;

/**
 * Maps free-form relationship labels (English or Arabic) onto {@link Relationship}.
 * Generic labels such as "Child" or "Spouse" are resolved from the heir group first and
 * the gender second. Labels that name a non-heir, or that cannot be read at all, become
 * {@link Relationship#EXCLUDED}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeirNormalizationService {

    private static final ArabicNormalizer ARABIC_NORMALIZER = new ArabicNormalizer();

    private static final Map<String, Relationship> SYNONYMS = new HashMap<>();
    private static final Map<String, Relationship[]> GENERIC = new HashMap<>();
    private static final Map<String, String> DISTANT_KINDRED = new HashMap<>();

    private static final Set<String> BARRED_TOKENS = Set.of(
            "step", "stepson", "stepdaughter", "stepchild", "stepchildren", "stepfather", "stepmother",
            "stepparent", "stepbrother", "stepsister", "adopted", "adoptive", "foster", "illegitimate");
    private static final Set<String> BARRED_ARABIC = Set.of("ربيب", "تبني", "متبني", "رضاع", "زنا");

    private static final Set<String> MALE_GROUP_WORDS = Set.of(
            "son", "sons", "husband", "husbands", "father", "fathers", "brother", "brothers", "grandson",
            "grandsons", "grandfather", "nephew", "nephews", "male", "males", "men", "boys", "ابناء", "ذكور");
    private static final Set<String> FEMALE_GROUP_WORDS = Set.of(
            "daughter", "daughters", "wife", "wives", "mother", "mothers", "sister", "sisters", "granddaughter",
            "granddaughters", "grandmother", "grandmothers", "female", "females", "women", "girls", "بنات",
            "زوجات", "اناث");

    static {
        for (Relationship r : Relationship.values()) {
            if (r != EXCLUDED) {
                SYNONYMS.put(key(r.getDisplayName()), r);
                SYNONYMS.put(key(r.name()), r);
                SYNONYMS.put(key(r.getArabicName()), r);
            }
        }
        synonyms(HUSBAND, "widower");
        synonyms(WIFE, "wives", "widow", "زوجات");
        synonyms(FATHER, "dad", "والد");
        synonyms(MOTHER, "mom", "mum", "والدة");
        synonyms(SON, "sons", "ابناء");
        synonyms(DAUGHTER, "daughters", "بنات");
        synonyms(GRANDSON, "grandsons", "son's son", "son of son", "son of a son", "ابن ابن", "حفيد");
        synonyms(GRANDDAUGHTER, "granddaughters", "son's daughter", "daughter of son", "daughter of a son", "بنت ابن", "حفيدة");
        synonyms(GRANDFATHER, "paternal grandfather", "father's father", "grandpa", "جد لأب", "أبو الأب");
        synonyms(GRANDMOTHER, "grandmothers", "paternal grandmother", "maternal grandmother", "father's mother",
                "mother's mother", "grandma", "جدة لأب", "جدة لأم", "أم الأب", "أم الأم");
        synonyms(FULL_BROTHER, "brother", "brothers", "full brothers", "germane brother", "أخ", "إخوة", "شقيق");
        synonyms(FULL_SISTER, "sister", "sisters", "full sisters", "germane sister", "أخت", "أخوات", "شقيقة");
        synonyms(CONSANGUINE_BROTHER, "paternal brother", "paternal half brother", "half brother paternal",
                "consanguine brothers", "brother by father", "أخ من الأب");
        synonyms(CONSANGUINE_SISTER, "paternal sister", "paternal half sister", "half sister paternal",
                "consanguine sisters", "sister by father", "أخت من الأب");
        synonyms(UTERINE_BROTHER, "maternal brother", "maternal half brother", "half brother maternal",
                "uterine brothers", "brother by mother", "أخ من الأم");
        synonyms(UTERINE_SISTER, "maternal sister", "maternal half sister", "half sister maternal",
                "uterine sisters", "sister by mother", "أخت من الأم");
        synonyms(FULL_NEPHEW, "nephew", "nephews", "brother's son", "full brother's son", "son of brother",
                "son of full brother", "ابن أخ", "ابن الأخ");

        generic(HUSBAND, WIFE, "spouse", "spouses", "partner", "widowed spouse");
        generic(SON, DAUGHTER, "child", "children", "kid", "kids", "offspring", "ولد", "أولاد");
        generic(GRANDSON, GRANDDAUGHTER, "grandchild", "grandchildren", "son's child", "son's children", "أحفاد");
        generic(FATHER, MOTHER, "parent", "parents", "الوالدين");
        generic(GRANDFATHER, GRANDMOTHER, "grandparent", "grandparents");
        generic(FULL_BROTHER, FULL_SISTER, "sibling", "siblings", "full sibling", "full siblings");
        generic(CONSANGUINE_BROTHER, CONSANGUINE_SISTER, "consanguine sibling", "paternal sibling",
                "paternal half sibling");
        generic(UTERINE_BROTHER, UTERINE_SISTER, "uterine sibling", "maternal sibling", "maternal half sibling");

        distantKindred("maternal grandfather", "mother's father", "grandfather maternal", "جد لأم", "أبو الأم");
        distantKindred("daughter's son", "daughter's daughter", "daughter's child", "daughter's children",
                "ابن البنت", "بنت البنت");
        distantKindred("aunt", "aunts", "paternal aunt", "maternal aunt", "maternal uncle", "عمة", "خالة", "خال");
        distantKindred("sister's son", "sister's daughter", "sister's child", "sister's children", "niece",
                "nieces", "brother's daughter", "uterine brother's son", "maternal half brother's son",
                "ابن الأخت", "بنت الأخت", "بنت الأخ");
    }

    private final FaraidProperties properties;

    public List<NormalizedHeir> normalize(List<HeirDto> heirs) {
        List<NormalizedHeir> normalized = new ArrayList<>(heirs.size());
        for (int i = 0; i < heirs.size(); i++) {
            NormalizedHeir heir = normalize(i, heirs.get(i));
            if (heir.unmapped()) {
                if (properties.isRejectUnmappedRelationships()) {
                    throw new InvalidInheritanceCaseException(heir.exclusionReason());
                }
                log.warn("Heir {} ({}): {}", heir.heir().id(), heir.displayName(), heir.exclusionReason());
            }
            normalized.add(heir);
        }
        return normalized;
    }

    public NormalizedHeir normalize(int position, HeirDto heir) {
        String raw = heir.relationship();
        if (raw == null || raw.isBlank()) {
            return NormalizedHeir.unmapped(position, heir, "No relationship given; treated as excluded");
        }
        String key = key(raw);

        Relationship exact = SYNONYMS.get(key);
        if (exact != null) {
            return NormalizedHeir.mapped(position, heir, exact);
        }

        Relationship[] pair = GENERIC.get(key);
        if (pair != null) {
            Relationship resolved = disambiguate(pair, heir);
            return resolved != null
                    ? NormalizedHeir.mapped(position, heir, resolved)
                    : NormalizedHeir.unmapped(position, heir, "Relationship '" + raw.trim()
                    + "' is ambiguous without a gender or heir group; treated as excluded");
        }

        if (isBarred(key)) {
            return NormalizedHeir.barred(position, heir, "'" + raw.trim()
                    + "' is a step, adoptive, foster or illegitimate relation and does not inherit");
        }
        if (DISTANT_KINDRED.containsKey(key) || containsToken(key, "aunt", "niece")) {
            return NormalizedHeir.barred(position, heir, "'" + raw.trim()
                    + "' belongs to the distant kindred (dhawu al-arham)");
        }
        if (key.contains("in law")) {
            return NormalizedHeir.barred(position, heir, "'" + raw.trim()
                    + "' is a relation by marriage and does not inherit");
        }

        return NormalizedHeir.unmapped(position, heir, "Unrecognised relationship '" + raw.trim()
                + "'; treated as excluded");
    }

    private Relationship disambiguate(Relationship[] pair, HeirDto heir) {
        if (heir.heirGroup() != null) {
            Set<String> words = tokens(key(heir.heirGroup()));
            boolean male = words.stream().anyMatch(MALE_GROUP_WORDS::contains);
            boolean female = words.stream().anyMatch(FEMALE_GROUP_WORDS::contains);
            if (male != female) {
                return male ? pair[0] : pair[1];
            }
        }
        return switch (Gender.parse(heir.gender())) {
            case MALE -> pair[0];
            case FEMALE -> pair[1];
            case UNKNOWN -> null;
        };
    }

    private static boolean isBarred(String key) {
        if (key.startsWith("step")) {
            return true;
        }
        for (String token : tokens(key)) {
            if (BARRED_TOKENS.contains(token)) {
                return true;
            }
        }
        return BARRED_ARABIC.stream().anyMatch(key::contains);
    }

    private static boolean containsToken(String key, String... candidates) {
        Set<String> words = tokens(key);
        return Arrays.stream(candidates).anyMatch(words::contains);
    }

    private static Set<String> tokens(String key) {
        return Arrays.stream(key.split(" "))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    static String key(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT)
                .replace("'s ", "s ")
                .replace("’s ", "s ")
                .replaceAll("['’]", "")
                .replaceAll("[-_/().,]+", " ")
                .replaceAll("\\s+", " ")
                .trim();
        char[] chars = s.toCharArray();
        int len = ARABIC_NORMALIZER.normalize(chars, chars.length);
        return Arrays.stream(new String(chars, 0, len).split(" "))
                .map(HeirNormalizationService::stripArabicArticle)
                .collect(Collectors.joining(" "));
    }

    private static String stripArabicArticle(String word) {
        return word.length() > 3 && word.startsWith("ال") ? word.substring(2) : word;
    }

    private static void synonyms(Relationship relationship, String... labels) {
        for (String label : labels) {
            SYNONYMS.put(key(label), relationship);
        }
    }

    private static void generic(Relationship male, Relationship female, String... labels) {
        for (String label : labels) {
            GENERIC.put(key(label), new Relationship[]{male, female});
        }
    }

    private static void distantKindred(String... labels) {
        for (String label : labels) {
            DISTANT_KINDRED.put(key(label), label);
        }
    }
}
