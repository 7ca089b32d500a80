package com.budgetpacing.service.ingestion;

import com.budgetpacing.client.SpendFeedClient;
import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.SpendReport;
import com.budgetpacing.entity.SnapshotSource;
import com.budgetpacing.entity.SpendSnapshot;
import com.budgetpacing.exception.AdPlatformException;
import com.budgetpacing.exception.InvariantViolationException;
import com.budgetpacing.exception.TransientIngestionException;
import com.budgetpacing.repository.jpa.SpendSnapshotRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Appends spend figures to the snapshot ledger. Figures arrive pulled from the spend feed or
 * pushed by it, possibly late or out of order; one snapshot is kept per timestamp bucket and
 * later arrivals for the same bucket are dropped.
 */
@Slf4j
@Service
public class SpendIngestionAdapter {

    private final SpendSnapshotRepository snapshotRepository;
    private final SpendFeedClient spendFeedClient;
    private final Duration bucketWidth;

    public SpendIngestionAdapter(
            SpendSnapshotRepository snapshotRepository,
            SpendFeedClient spendFeedClient,
            PacingProperties properties) {
        this.snapshotRepository = snapshotRepository;
        this.spendFeedClient = spendFeedClient;
        this.bucketWidth = properties.getMonitoring().getSnapshotBucket();
    }

    /**
     * Pulls the latest figure from the feed and records it.
     *
     * @return the newest snapshot in the ledger after the pull, which is the pulled one unless
     *     the feed returned nothing new
     * @throws TransientIngestionException when the feed cannot be reached
     */
    public Optional<SpendSnapshot> pull(String campaignId) {
        Optional<SpendReport> report;
        try {
            report = spendFeedClient.fetchLatest(campaignId);
        } catch (AdPlatformException e) {
            throw new TransientIngestionException(
                    campaignId, "Spend feed unavailable: " + e.getMessage(), e);
        }
        report.ifPresent(r -> record(r, SnapshotSource.PULL));
        return latest(campaignId);
    }

    /** @return the stored snapshot, or empty when its bucket was already filled */
    public Optional<SpendSnapshot> record(SpendReport report, SnapshotSource source) {
        String campaignId = report.getCampaignId();
        if (report.getCumulativeSpendMonthToDate() == null
                || report.getCumulativeSpendMonthToDate().signum() < 0
                || report.getDailySpend() == null
                || report.getDailySpend().signum() < 0) {
            throw new InvariantViolationException(
                    campaignId, "Spend report with missing or negative spend: " + report);
        }

        LocalDateTime bucketStart = bucketStart(report.getCapturedAt());
        if (snapshotRepository.existsByCampaignIdAndBucketStart(campaignId, bucketStart)) {
            log.debug(
                    "Duplicate spend snapshot dropped: campaignId={}, bucketStart={}",
                    campaignId,
                    bucketStart);
            return Optional.empty();
        }

        SpendSnapshot snapshot =
                SpendSnapshot.builder()
                        .campaignId(campaignId)
                        .capturedAt(report.getCapturedAt())
                        .bucketStart(bucketStart)
                        .cumulativeSpendMonthToDate(report.getCumulativeSpendMonthToDate())
                        .dailySpend(report.getDailySpend())
                        .sourceConfidence(report.getSourceConfidence())
                        .source(source)
                        .build();
        try {
            SpendSnapshot saved = snapshotRepository.saveAndFlush(snapshot);
            log.debug(
                    "Spend snapshot recorded: campaignId={}, capturedAt={}, spendMtd={}, source={}",
                    campaignId,
                    saved.getCapturedAt(),
                    saved.getCumulativeSpendMonthToDate(),
                    source);
            return Optional.of(saved);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent report for the same bucket
            log.debug(
                    "Concurrent spend snapshot dropped: campaignId={}, bucketStart={}",
                    campaignId,
                    bucketStart);
            return Optional.empty();
        }
    }

    public Optional<SpendSnapshot> latest(String campaignId) {
        return snapshotRepository.findFirstByCampaignIdOrderByCapturedAtDesc(campaignId);
    }

    /**
     * How long cumulative spend has stood still at the latest snapshot's value, counted from the
     * first snapshot in the period that reached it.
     */
    public Duration zeroSpendDuration(
            String campaignId, SpendSnapshot latest, LocalDateTime periodStart) {
        return snapshotRepository
                .findFirstCapturedAtReaching(
                        campaignId, periodStart, latest.getCumulativeSpendMonthToDate())
                .map(since -> Duration.between(since, latest.getCapturedAt()))
                .filter(d -> !d.isNegative())
                .orElse(Duration.ZERO);
    }

    LocalDateTime bucketStart(LocalDateTime capturedAt) {
        long width = bucketWidth.getSeconds();
        long epoch = capturedAt.toEpochSecond(ZoneOffset.UTC);
        return LocalDateTime.ofEpochSecond(Math.floorDiv(epoch, width) * width, 0, ZoneOffset.UTC);
    }
}
