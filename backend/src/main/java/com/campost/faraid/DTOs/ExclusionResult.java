package com.campost.faraid.DTOs;

import java.util.List;
import java.util.Map;

/**
 * Heirs blocked by Hajb, keyed by roster position, with the notes explaining each decision.
 */
public record ExclusionResult(
        Map<Integer, String> excluded,
        List<NormalizedHeir> activeHeirs,
        List<String> notes
) {
    public boolean isExcluded(NormalizedHeir heir) {
        return excluded.containsKey(heir.position());
    }
}
