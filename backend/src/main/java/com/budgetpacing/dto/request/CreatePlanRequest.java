package com.budgetpacing.dto.request;

import com.budgetpacing.entity.PacingStrategy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePlanRequest {
    @NotBlank(message = "Campaign ID is required")
    private String campaignId;

    @NotNull(message = "Monthly budget is required")
    @DecimalMin(value = "0.00", message = "Monthly budget must be non-negative")
    private BigDecimal monthlyBudget;

    /** Defaults to the first day of the current month */
    private LocalDate periodStart;

    /** Defaults to the last day of the start's month */
    private LocalDate periodEnd;

    @Builder.Default private PacingStrategy strategy = PacingStrategy.EVEN;
}
