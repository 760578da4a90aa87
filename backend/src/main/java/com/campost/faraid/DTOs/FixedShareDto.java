package com.campost.faraid.DTOs;

import com.campost.faraid.Entity.Enum.FixedShare;
import com.campost.faraid.Entity.Enum.Relationship;
import com.campost.faraid.Entity.Enum.ShareType;

import java.util.Set;

/**
 * Outcome of one fixed-share rule: the share (if any) that the heirs of the given
 * relationships split equally between them.
 */
public record FixedShareDto(
        Set<Relationship> relationships,
        ShareType shareType,
        FixedShare fixedShare,
        String reason
) {
    public FixedShareDto(Relationship relationship, ShareType shareType, FixedShare fixedShare, String reason) {
        this(Set.of(relationship), shareType, fixedShare, reason);
    }

    public boolean hasFixedShare() {
        return fixedShare != null;
    }
}
