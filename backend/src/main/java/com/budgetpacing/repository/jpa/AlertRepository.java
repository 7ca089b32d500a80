package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.Alert;
import com.budgetpacing.entity.AlertType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    Optional<Alert> findByOpenKey(String openKey);

    List<Alert> findByCampaignIdAndResolvedAtIsNullOrderByCreatedAtDesc(String campaignId);

    List<Alert> findByCampaignIdOrderByCreatedAtDesc(String campaignId, Pageable pageable);

    List<Alert> findByCampaignIdAndType(String campaignId, AlertType type);

    long countByResolvedAtIsNull();
}
