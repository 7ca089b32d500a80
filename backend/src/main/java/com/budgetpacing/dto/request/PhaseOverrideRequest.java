package com.budgetpacing.dto.request;

import com.budgetpacing.entity.PacingPhase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseOverrideRequest {
    @NotNull(message = "Target phase is required")
    private PacingPhase phase;

    /** Version of the pacing state the operator looked at */
    @NotNull(message = "Expected version is required")
    private Long expectedVersion;

    @NotBlank(message = "Actor is required")
    private String actor;

    private String reason;
}
