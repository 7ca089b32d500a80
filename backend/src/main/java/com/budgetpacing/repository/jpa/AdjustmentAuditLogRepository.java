package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.AdjustmentAuditLog;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AdjustmentAuditLogRepository extends JpaRepository<AdjustmentAuditLog, Long> {

    List<AdjustmentAuditLog> findByAdjustmentIdOrderByCreatedAtAsc(Long adjustmentId);
}
