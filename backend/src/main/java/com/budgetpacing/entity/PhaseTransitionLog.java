package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@Table(
        name = "phase_transition_log",
        indexes = {
            @Index(name = "idx_phase_log_campaign", columnList = "campaign_id, transitioned_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTransitionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, length = 64)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_phase", length = 20)
    private PacingPhase fromPhase;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_phase", nullable = false, length = 20)
    private PacingPhase toPhase;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 30)
    private TransitionTrigger trigger;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "actor", length = 100)
    private String actor;

    @Column(name = "transitioned_at", nullable = false)
    private LocalDateTime transitionedAt;
}
