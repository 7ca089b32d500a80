package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.AdjustmentKind;
import com.budgetpacing.entity.AdjustmentStatus;
import com.budgetpacing.entity.BudgetAdjustment;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BudgetAdjustmentRepository extends JpaRepository<BudgetAdjustment, Long> {

    Optional<BudgetAdjustment> findByCampaignIdAndEvaluationBucket(
            String campaignId, Long evaluationBucket);

    List<BudgetAdjustment> findByCampaignIdOrderByCreatedAtDesc(
            String campaignId, Pageable pageable);

    List<BudgetAdjustment> findByCampaignIdAndStatus(String campaignId, AdjustmentStatus status);

    List<BudgetAdjustment> findByStatusAndRequiresApprovalTrueOrderByCreatedAtAsc(
            AdjustmentStatus status);

    /** Pending approvals whose expiry window has elapsed */
    @Query(
            """
        SELECT a FROM BudgetAdjustment a
        WHERE a.status = com.budgetpacing.entity.AdjustmentStatus.PENDING
        AND a.requiresApproval = true
        AND a.expiresAt <= :now
        ORDER BY a.expiresAt ASC
        """)
    List<BudgetAdjustment> findExpiredPending(@Param("now") LocalDateTime now);

    long countByStatusAndRequiresApprovalTrue(AdjustmentStatus status);

    Optional<BudgetAdjustment> findFirstByCampaignIdAndStatusOrderByAppliedAtDesc(
            String campaignId, AdjustmentStatus status);

    boolean existsByCampaignIdAndKindAndStatus(
            String campaignId, AdjustmentKind kind, AdjustmentStatus status);
}
