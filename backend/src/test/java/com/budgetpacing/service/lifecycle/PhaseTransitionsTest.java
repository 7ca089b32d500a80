package com.budgetpacing.service.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.TransitionTrigger;
import org.junit.jupiter.api.Test;

class PhaseTransitionsTest {

    @Test
    void isAllowed_BandPhases_MoveBothWays() {
        assertTrue(
                PhaseTransitions.isAllowed(
                        PacingPhase.ACTIVE, PacingPhase.THROTTLED, TransitionTrigger.PACING_BAND));
        assertTrue(
                PhaseTransitions.isAllowed(
                        PacingPhase.THROTTLED, PacingPhase.ACTIVE, TransitionTrigger.PACING_BAND));
    }

    @Test
    void isAllowed_AnyLivePhase_CanAwaitApproval() {
        for (PacingPhase from : PacingPhase.values()) {
            if (from == PacingPhase.AWAITING_APPROVAL) {
                continue;
            }
            assertTrue(
                    PhaseTransitions.isAllowed(
                            from,
                            PacingPhase.AWAITING_APPROVAL,
                            TransitionTrigger.APPROVAL_REQUIRED),
                    from.name());
        }
    }

    @Test
    void isAllowed_DormantToActive_OnlyOnRollover() {
        for (PacingPhase dormant : new PacingPhase[] {PacingPhase.EXHAUSTED, PacingPhase.PAUSED}) {
            assertFalse(
                    PhaseTransitions.isAllowed(
                            dormant, PacingPhase.ACTIVE, TransitionTrigger.MANUAL_OVERRIDE));
            assertFalse(
                    PhaseTransitions.isAllowed(
                            dormant, PacingPhase.THROTTLED, TransitionTrigger.PACING_BAND));
            assertTrue(
                    PhaseTransitions.isAllowed(
                            dormant, PacingPhase.ACTIVE, TransitionTrigger.PERIOD_ROLLOVER));
        }
    }

    @Test
    void isAllowed_Rollover_OnlyTargetsActive() {
        assertFalse(
                PhaseTransitions.isAllowed(
                        PacingPhase.ACTIVE, PacingPhase.PAUSED, TransitionTrigger.PERIOD_ROLLOVER));
    }

    @Test
    void bandPhase_MapsOutsideBandToThrottled() {
        assertEquals(PacingPhase.THROTTLED, PhaseTransitions.bandPhase(true));
        assertEquals(PacingPhase.ACTIVE, PhaseTransitions.bandPhase(false));
    }
}
