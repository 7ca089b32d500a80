package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.PhaseTransitionLog;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PhaseTransitionLogRepository extends JpaRepository<PhaseTransitionLog, Long> {

    List<PhaseTransitionLog> findByCampaignIdOrderByTransitionedAtAsc(String campaignId);
}
