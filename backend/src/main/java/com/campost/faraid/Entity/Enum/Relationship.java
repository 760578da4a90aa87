package com.campost.faraid.Entity.Enum;

import com.campost.faraid.util.InheritanceCase;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum Relationship {
    // ====== الأزواج ======
    HUSBAND("Husband", "زوج", 1),
    WIFE("Wife", "زوجة", 4),

    // ====== الأصول ======
    FATHER("Father", "أب", 1),
    MOTHER("Mother", "أم", 1),
    GRANDFATHER("Grandfather", "جد", 1),
    GRANDMOTHER("Grandmother", "جدة", null),

    // ====== الفروع ======
    SON("Son", "ابن", null),
    DAUGHTER("Daughter", "بنت", null),
    GRANDSON("Grandson", "ابن الابن", null),
    GRANDDAUGHTER("Granddaughter", "بنت الابن", null),

    // ====== الإخوة ======
    FULL_BROTHER("Full Brother", "أخ شقيق", null),
    FULL_SISTER("Full Sister", "أخت شقيقة", null),
    CONSANGUINE_BROTHER("Consanguine Brother", "أخ لأب", null),
    CONSANGUINE_SISTER("Consanguine Sister", "أخت لأب", null),
    UTERINE_BROTHER("Uterine Brother", "أخ لأم", null),
    UTERINE_SISTER("Uterine Sister", "أخت لأم", null),

    // ====== أبناء الإخوة ======
    FULL_NEPHEW("Full Nephew", "ابن الأخ الشقيق", null),

    // ====== غير الورثة ======
    EXCLUDED("Excluded", "غير وارث", null);

    private final String displayName;
    private final String arabicName;
    private final Integer maxAllowed;

    public int getAsabaUnit() {
        return switch (this) {
            // الذكور = 2
            case SON, GRANDSON, FATHER, GRANDFATHER,
                 FULL_BROTHER, CONSANGUINE_BROTHER, FULL_NEPHEW -> 2;

            // الإناث = 1
            case DAUGHTER, GRANDDAUGHTER, FULL_SISTER, CONSANGUINE_SISTER -> 1;

            case HUSBAND, WIFE, MOTHER, GRANDMOTHER,
                 UTERINE_BROTHER, UTERINE_SISTER, EXCLUDED -> 0;
        };
    }

    public AsabaType getAsabaType(InheritanceCase c) {
        return switch (this) {
            case SON, GRANDSON, FATHER, GRANDFATHER,
                 FULL_BROTHER, CONSANGUINE_BROTHER, FULL_NEPHEW -> AsabaType.BY_SELF;

            case DAUGHTER -> c.has(SON) ? AsabaType.WITH_OTHER : AsabaType.NONE;
            case GRANDDAUGHTER -> c.has(GRANDSON) ? AsabaType.WITH_OTHER : AsabaType.NONE;
            case FULL_SISTER -> siblingAsabaType(c, FULL_BROTHER);
            case CONSANGUINE_SISTER -> siblingAsabaType(c, CONSANGUINE_BROTHER);

            case HUSBAND, WIFE, MOTHER, GRANDMOTHER,
                 UTERINE_BROTHER, UTERINE_SISTER, EXCLUDED -> AsabaType.NONE;
        };
    }

    public boolean canBeAsaba(InheritanceCase c) {
        if (this == FATHER || this == GRANDFATHER) {
            return !c.hasMaleDescendant();
        }
        return getAsabaType(c) != AsabaType.NONE;
    }

    public boolean isSpouse() {
        return this == HUSBAND || this == WIFE;
    }

    public boolean isSibling() {
        return switch (this) {
            case FULL_BROTHER, FULL_SISTER,
                 CONSANGUINE_BROTHER, CONSANGUINE_SISTER,
                 UTERINE_BROTHER, UTERINE_SISTER -> true;
            default -> false;
        };
    }

    private static AsabaType siblingAsabaType(InheritanceCase c, Relationship brother) {
        if (c.has(brother)) {
            return AsabaType.WITH_OTHER;
        }
        // الأخوات مع البنات عصبات
        return c.hasFemaleDescendantOnly() ? AsabaType.WITH_ANOTHER : AsabaType.NONE;
    }
}
