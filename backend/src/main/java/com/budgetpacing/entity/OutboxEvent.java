package com.budgetpacing.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pacing event stored with the change that produced it and relayed to Kafka once that change
 * has committed. Keyed by campaign; {@code sourceId} is the adjustment or alert it describes.
 */
@Entity
@Table(
        name = "pacing_outbox",
        indexes = {
            @Index(
                    name = "idx_outbox_due",
                    columnList = "published_at, next_attempt_at, id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

    private static final long MAX_BACKOFF_MINUTES = 60;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 64)
    private String campaignId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 40)
    private String eventType;

    @Column(name = "source_id", updatable = false)
    private Long sourceId;

    @Column(name = "topic", nullable = false, updatable = false, length = 100)
    private String topic;

    @Lob
    @Column(name = "payload", nullable = false, updatable = false)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;

    /** Null until the broker acknowledged the send */
    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    public boolean isPublished() {
        return publishedAt != null;
    }

    public void published(LocalDateTime now) {
        this.publishedAt = now;
        this.lastError = null;
    }

    /** Doubles the wait after every failed send: 2, 4, 8 minutes and so on, at most an hour */
    public void sendFailed(String error, LocalDateTime now) {
        attempts++;
        lastError = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        long backoff = Math.min(1L << Math.min(attempts, 6), MAX_BACKOFF_MINUTES);
        nextAttemptAt = now.plusMinutes(backoff);
    }
}
