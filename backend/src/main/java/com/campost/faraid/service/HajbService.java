package com.campost.faraid.service;

import com.campost.faraid.DTOs.ExclusionResult;
import com.campost.faraid.DTOs.NormalizedHeir;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.util.InheritanceCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.campost.faraid.Entity.Enum.Relationship.*;

/**
 * Hajb: decides which heirs are blocked by a closer relative. Every rule reads the
 * roster-wide predicates of {@link InheritanceCase}, never the other heirs one by one.
 */
@Slf4j
@Service
public class HajbService {

    public ExclusionResult resolve(List<NormalizedHeir> roster, InheritanceCase c) {
        Map<Integer, String> excluded = new LinkedHashMap<>();
        List<NormalizedHeir> active = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        for (NormalizedHeir heir : roster) {
            String blocker = blockedBy(heir, c);
            if (blocker == null) {
                active.add(heir);
                continue;
            }
            excluded.put(heir.position(), blocker);
            String note = heir.isBarred()
                    ? heir.displayName() + " is excluded: " + blocker
                    : heir.displayName() + " (" + heir.relationship().getDisplayName() + ") is excluded by " + blocker;
            notes.add(note);
            log.debug(note);
        }
        return new ExclusionResult(
                Collections.unmodifiableMap(excluded),
                Collections.unmodifiableList(active),
                Collections.unmodifiableList(notes));
    }

    /**
     * @return the blocking relative (or the reason the relation never inherits), or
     * {@code null} when the heir is not blocked
     */
    String blockedBy(NormalizedHeir heir, InheritanceCase c) {
        Relationship relationship = heir.relationship();
        return switch (relationship) {
            case HUSBAND, WIFE, FATHER, MOTHER, SON, DAUGHTER -> null;

            // ====== الفروع ======
            case GRANDSON -> c.has(SON) ? "the Son" : null;
            case GRANDDAUGHTER -> {
                if (c.has(SON)) yield "the Son";
                yield c.count(DAUGHTER) >= 2 && !c.has(GRANDSON) ? "two or more Daughters" : null;
            }

            // ====== الأصول ======
            case GRANDFATHER -> c.has(FATHER) ? "the Father" : null;
            case GRANDMOTHER -> c.has(MOTHER) ? "the Mother" : null;

            // ====== الإخوة ======
            case FULL_BROTHER, FULL_SISTER -> siblingBlocker(c);
            case CONSANGUINE_BROTHER -> first(siblingBlocker(c), c.has(FULL_BROTHER) ? "the Full Brother" : null);
            case CONSANGUINE_SISTER -> first(siblingBlocker(c), c.has(FULL_BROTHER) ? "the Full Brother" : null,
                    c.count(FULL_SISTER) >= 2 && !c.has(CONSANGUINE_BROTHER) ? "two or more Full Sisters" : null);
            case UTERINE_BROTHER, UTERINE_SISTER -> first(siblingBlocker(c),
                    c.hasDescendant() ? "a descendant" : null,
                    c.has(GRANDFATHER) ? "the Grandfather" : null);

            case FULL_NEPHEW -> first(maleDescendant(c),
                    c.has(FATHER) ? "the Father" : null,
                    c.has(GRANDFATHER) ? "the Grandfather" : null,
                    c.has(FULL_BROTHER) ? "the Full Brother" : null);

            // ====== غير الورثة ======
            case EXCLUDED -> heir.exclusionReason() != null
                    ? heir.exclusionReason()
                    : "the relation does not inherit";
        };
    }

    private static String siblingBlocker(InheritanceCase c) {
        return first(maleDescendant(c), c.has(FATHER) ? "the Father" : null);
    }

    private static String maleDescendant(InheritanceCase c) {
        if (c.has(SON)) return "the Son";
        return c.has(GRANDSON) ? "the Grandson" : null;
    }

    private static String first(String... blockers) {
        for (String blocker : blockers) {
            if (blocker != null) {
                return blocker;
            }
        }
        return null;
    }
}
