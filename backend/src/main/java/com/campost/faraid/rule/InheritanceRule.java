package com.campost.faraid.rule;

import com.campost.faraid.DTOs.FixedShareDto;
import com.campost.faraid.util.InheritanceCase;

/**
 * A fixed-share (Furud) rule for one category of heir. Rules only see heirs that survived
 * Hajb; {@link #calculate} returns {@code null} when the category takes no share.
 */
public interface InheritanceRule {

    boolean canApply(InheritanceCase c);

    FixedShareDto calculate(InheritanceCase c);
}
