package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.OutboxEvent;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /** Unpublished events due for a send, in insertion order so each campaign stays ordered */
    @Query(
            """
        SELECT e FROM OutboxEvent e
        WHERE e.publishedAt IS NULL
        AND e.nextAttemptAt <= :now
        AND e.attempts < :maxAttempts
        ORDER BY e.id
        """)
    List<OutboxEvent> findDue(
            @Param("now") LocalDateTime now,
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable);

    @Modifying
    @Query("DELETE FROM OutboxEvent e WHERE e.publishedAt < :cutoff")
    int deletePublishedBefore(@Param("cutoff") LocalDateTime cutoff);

    long countByPublishedAtIsNull();

    /** Events the relay has given up on */
    long countByPublishedAtIsNullAndAttemptsGreaterThanEqual(int maxAttempts);
}
