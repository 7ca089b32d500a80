package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.BudgetPlan;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BudgetPlanRepository extends JpaRepository<BudgetPlan, Long> {

    /** Plan whose period covers the given date */
    @Query(
            """
        SELECT p FROM BudgetPlan p
        WHERE p.campaignId = :campaignId
        AND p.periodStart <= :date
        AND p.periodEnd >= :date
        """)
    Optional<BudgetPlan> findCovering(
            @Param("campaignId") String campaignId, @Param("date") LocalDate date);

    Optional<BudgetPlan> findByCampaignIdAndPeriodStart(String campaignId, LocalDate periodStart);

    /** Most recent plan for a campaign, whatever its period */
    Optional<BudgetPlan> findFirstByCampaignIdOrderByPeriodStartDesc(String campaignId);

    List<BudgetPlan> findByCurrentTrue();

    boolean existsByCampaignIdAndPeriodStart(String campaignId, LocalDate periodStart);
}
