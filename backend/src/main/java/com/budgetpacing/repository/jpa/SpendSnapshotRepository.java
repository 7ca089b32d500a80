package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.SpendSnapshot;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SpendSnapshotRepository extends JpaRepository<SpendSnapshot, Long> {

    Optional<SpendSnapshot> findFirstByCampaignIdOrderByCapturedAtDesc(String campaignId);

    boolean existsByCampaignIdAndBucketStart(String campaignId, LocalDateTime bucketStart);

    /** Snapshots captured inside a window, oldest first */
    List<SpendSnapshot> findByCampaignIdAndCapturedAtBetweenOrderByCapturedAtAsc(
            String campaignId, LocalDateTime from, LocalDateTime to);

    /**
     * When the cumulative spend first reached {@code amount} since {@code since}. With a
     * non-decreasing ledger this is the moment spend stopped growing.
     */
    @Query(
            """
        SELECT MIN(s.capturedAt) FROM SpendSnapshot s
        WHERE s.campaignId = :campaignId
        AND s.capturedAt >= :since
        AND s.cumulativeSpendMonthToDate >= :amount
        """)
    Optional<LocalDateTime> findFirstCapturedAtReaching(
            @Param("campaignId") String campaignId,
            @Param("since") LocalDateTime since,
            @Param("amount") BigDecimal amount);
}
