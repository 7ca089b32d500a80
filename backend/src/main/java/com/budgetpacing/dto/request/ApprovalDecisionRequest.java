package com.budgetpacing.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecisionRequest {
    @NotBlank(message = "Actor is required")
    private String actor;

    @Size(max = 500, message = "Note cannot exceed 500 characters")
    private String note;
}
