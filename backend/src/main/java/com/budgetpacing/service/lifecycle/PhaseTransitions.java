package com.budgetpacing.service.lifecycle;

import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.TransitionTrigger;
import java.util.EnumSet;
import java.util.Map;

/** Allowed phase transitions. Lifecycle phases are never compared as strings. */
public final class PhaseTransitions {

    private static final Map<PacingPhase, EnumSet<PacingPhase>> VALID_TRANSITIONS =
            Map.of(
                    PacingPhase.ACTIVE,
                            EnumSet.of(
                                    PacingPhase.THROTTLED,
                                    PacingPhase.EXHAUSTED,
                                    PacingPhase.PAUSED,
                                    PacingPhase.AWAITING_APPROVAL),
                    PacingPhase.THROTTLED,
                            EnumSet.of(
                                    PacingPhase.ACTIVE,
                                    PacingPhase.EXHAUSTED,
                                    PacingPhase.PAUSED,
                                    PacingPhase.AWAITING_APPROVAL),
                    PacingPhase.AWAITING_APPROVAL,
                            EnumSet.of(
                                    PacingPhase.ACTIVE,
                                    PacingPhase.THROTTLED,
                                    PacingPhase.EXHAUSTED,
                                    PacingPhase.PAUSED),
                    // dormant phases leave for ACTIVE only on a period rollover
                    PacingPhase.EXHAUSTED, EnumSet.of(PacingPhase.AWAITING_APPROVAL),
                    PacingPhase.PAUSED, EnumSet.of(PacingPhase.AWAITING_APPROVAL));

    private PhaseTransitions() {}

    public static boolean isAllowed(PacingPhase from, PacingPhase to, TransitionTrigger trigger) {
        if (trigger == TransitionTrigger.PERIOD_ROLLOVER) {
            return to == PacingPhase.ACTIVE;
        }
        EnumSet<PacingPhase> allowed = VALID_TRANSITIONS.get(from);
        return allowed != null && allowed.contains(to);
    }

    /** Band phase matching whether the ratio is inside the normal band */
    public static PacingPhase bandPhase(boolean outsideBand) {
        return outsideBand ? PacingPhase.THROTTLED : PacingPhase.ACTIVE;
    }
}
