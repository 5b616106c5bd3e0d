package com.openforge.physiomate.agent.tool;

/**
 * Side channel a sub-agent tool reports its progress through.
 * Implementations must not block.
 */
@FunctionalInterface
public interface SubstepListener {

    SubstepListener NOOP = substep -> { };

    void onSubstep(Substep substep);
}
