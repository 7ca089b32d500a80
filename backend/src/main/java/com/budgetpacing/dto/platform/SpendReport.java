package com.budgetpacing.dto.platform;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One spend figure from the metrics feed, pulled or pushed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendReport {

    @NotBlank private String campaignId;

    @NotNull private LocalDateTime capturedAt;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal cumulativeSpendMonthToDate;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal dailySpend;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double sourceConfidence = 1.0;
}
