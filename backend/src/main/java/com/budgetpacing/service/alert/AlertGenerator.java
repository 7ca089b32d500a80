package com.budgetpacing.service.alert;

import com.budgetpacing.entity.Alert;
import com.budgetpacing.entity.AlertType;
import com.budgetpacing.exception.ResourceNotFoundException;
import com.budgetpacing.monitoring.PacingMetrics;
import com.budgetpacing.producer.PacingEventProducer;
import com.budgetpacing.repository.jpa.AlertRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Raises deduplicated alerts: at most one open alert per (campaign, type), re-raised only after
 * the previous one is resolved.
 *
 * <p>Alerts are written in their own transaction so they survive a rollback of the work that
 * triggered them.
 */
@Slf4j
@Service
public class AlertGenerator {

    private final AlertRepository alertRepository;
    private final AlertRules alertRules;
    private final PacingEventProducer eventProducer;
    private final PacingMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public AlertGenerator(
            AlertRepository alertRepository,
            AlertRules alertRules,
            PacingEventProducer eventProducer,
            PacingMetrics metrics,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.alertRepository = alertRepository;
        this.alertRules = alertRules;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /** Raises the alert unless one of the same type is already open for the campaign */
    public Optional<Alert> raise(AlertRequest request) {
        String openKey = Alert.openKey(request.getCampaignId(), request.getType());
        try {
            Alert alert = requiresNew.execute(status -> insertIfAbsent(request, openKey));
            if (alert == null) {
                log.debug(
                        "Alert already open: campaignId={}, type={}",
                        request.getCampaignId(),
                        request.getType());
                return Optional.empty();
            }
            metrics.recordAlert(alert.getType());
            log.warn(
                    "Alert raised: campaignId={}, type={}, severity={}, message={}",
                    alert.getCampaignId(),
                    alert.getType(),
                    alert.getSeverity(),
                    alert.getMessage());
            return Optional.of(alert);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent raise of the same alert
            log.debug(
                    "Alert raised concurrently: campaignId={}, type={}",
                    request.getCampaignId(),
                    request.getType());
            return Optional.empty();
        }
    }

    private Alert insertIfAbsent(AlertRequest request, String openKey) {
        if (alertRepository.findByOpenKey(openKey).isPresent()) {
            return null;
        }
        Alert alert =
                alertRepository.saveAndFlush(
                        Alert.builder()
                                .campaignId(request.getCampaignId())
                                .type(request.getType())
                                .severity(request.getSeverity())
                                .message(request.getMessage())
                                .recommendedAction(request.getRecommendedAction())
                                .currentSpend(request.getCurrentSpend())
                                .budgetLimit(request.getBudgetLimit())
                                .projectedSpend(request.getProjectedSpend())
                                .openKey(openKey)
                                .createdAt(LocalDateTime.now(clock))
                                .build());
        eventProducer.publishAlertRaised(alert);
        return alert;
    }

    /** Applies the per-cycle threshold rules: raises what fires, auto-resolves what cleared */
    public List<Alert> applyCycle(CycleSignals signals) {
        AlertDecisions decisions = alertRules.evaluate(signals);
        resolveOpen(signals.getCampaignId(), decisions.toResolve(), "auto");
        List<Alert> raised = new ArrayList<>();
        for (AlertRequest request : decisions.toRaise()) {
            raise(request).ifPresent(raised::add);
        }
        return raised;
    }

    /** Resolves open alerts of the given types; returns how many were open */
    public int resolveOpen(String campaignId, Collection<AlertType> types, String resolvedBy) {
        if (types.isEmpty()) {
            return 0;
        }
        Integer resolved =
                requiresNew.execute(
                        status -> {
                            int count = 0;
                            LocalDateTime now = LocalDateTime.now(clock);
                            for (AlertType type : types) {
                                Optional<Alert> open =
                                        alertRepository.findByOpenKey(
                                                Alert.openKey(campaignId, type));
                                if (open.isPresent()) {
                                    open.get().resolve(resolvedBy, now);
                                    alertRepository.save(open.get());
                                    count++;
                                }
                            }
                            return count;
                        });
        if (resolved != null && resolved > 0) {
            log.info(
                    "Resolved {} alerts: campaignId={}, types={}, resolvedBy={}",
                    resolved,
                    campaignId,
                    types,
                    resolvedBy);
        }
        return resolved == null ? 0 : resolved;
    }

    /** Operator resolution */
    @Transactional
    public Alert resolve(Long alertId, String resolvedBy) {
        Alert alert =
                alertRepository
                        .findById(alertId)
                        .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        if (!alert.isOpen()) {
            return alert;
        }
        alert.resolve(resolvedBy, LocalDateTime.now(clock));
        log.info(
                "Alert resolved: alertId={}, campaignId={}, type={}, resolvedBy={}",
                alertId,
                alert.getCampaignId(),
                alert.getType(),
                resolvedBy);
        return alertRepository.save(alert);
    }
}
