package com.budgetpacing.controller;

import com.budgetpacing.dto.platform.SpendReport;
import com.budgetpacing.dto.request.ApprovalDecisionRequest;
import com.budgetpacing.dto.request.CreatePlanRequest;
import com.budgetpacing.dto.request.PhaseOverrideRequest;
import com.budgetpacing.dto.request.ResolveAlertRequest;
import com.budgetpacing.dto.response.AdjustmentResponse;
import com.budgetpacing.dto.response.AlertResponse;
import com.budgetpacing.dto.response.OverviewResponse;
import com.budgetpacing.dto.response.PacingStateResponse;
import com.budgetpacing.dto.response.PlanResponse;
import com.budgetpacing.dto.response.RecommendationResponse;
import com.budgetpacing.entity.EvaluationOutcome;
import com.budgetpacing.entity.SnapshotSource;
import com.budgetpacing.service.alert.AlertGenerator;
import com.budgetpacing.service.approval.ApprovalGate;
import com.budgetpacing.service.evaluation.CampaignEvaluationService;
import com.budgetpacing.service.ingestion.SpendIngestionAdapter;
import com.budgetpacing.service.lifecycle.LifecycleController;
import com.budgetpacing.service.plan.BudgetPlanService;
import com.budgetpacing.service.query.PacingQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator and dashboard API of the pacing engine */
@Slf4j
@RestController
@RequestMapping("/api/v1/pacing")
@RequiredArgsConstructor
@Validated
@Tag(name = "Budget pacing", description = "Pacing state, alerts, approvals and plans")
public class PacingController {

    private final BudgetPlanService planService;
    private final PacingQueryService queryService;
    private final LifecycleController lifecycleController;
    private final ApprovalGate approvalGate;
    private final AlertGenerator alertGenerator;
    private final SpendIngestionAdapter spendIngestion;
    private final CampaignEvaluationService evaluationService;

    @PostMapping("/plans")
    @Operation(
            summary = "Create a budget plan",
            responses = {
                @ApiResponse(responseCode = "201", description = "Plan created"),
                @ApiResponse(responseCode = "400", description = "Invalid or duplicate plan")
            })
    public ResponseEntity<PlanResponse> createPlan(@Valid @RequestBody CreatePlanRequest request) {
        log.info(
                "Creating budget plan: campaignId={}, budget={}",
                request.getCampaignId(),
                request.getMonthlyBudget());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PlanResponse.from(planService.createPlan(request)));
    }

    @GetMapping("/campaigns/{campaignId}/state")
    @Operation(summary = "Current pacing state of a campaign")
    public ResponseEntity<PacingStateResponse> getState(@PathVariable String campaignId) {
        return ResponseEntity.ok(queryService.getState(campaignId));
    }

    @PutMapping("/campaigns/{campaignId}/phase")
    @Operation(
            summary = "Override the pacing phase",
            description = "Compare-and-swap on the state version the operator last read",
            responses = {
                @ApiResponse(responseCode = "200", description = "Phase changed"),
                @ApiResponse(responseCode = "409", description = "Stale version or illegal move")
            })
    public ResponseEntity<PacingStateResponse> overridePhase(
            @PathVariable String campaignId, @Valid @RequestBody PhaseOverrideRequest request) {
        lifecycleController.manualOverride(
                campaignId,
                request.getPhase(),
                request.getExpectedVersion(),
                request.getActor(),
                request.getReason() != null ? request.getReason() : "Manual override");
        return ResponseEntity.ok(queryService.getState(campaignId));
    }

    @GetMapping("/campaigns/{campaignId}/alerts")
    public ResponseEntity<List<AlertResponse>> getAlerts(
            @PathVariable String campaignId,
            @Parameter(description = "Only alerts that are still open")
                    @RequestParam(defaultValue = "true")
                    boolean openOnly,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(queryService.getAlerts(campaignId, openOnly, limit));
    }

    @PostMapping("/alerts/{alertId}/resolve")
    public ResponseEntity<AlertResponse> resolveAlert(
            @PathVariable Long alertId, @Valid @RequestBody ResolveAlertRequest request) {
        return ResponseEntity.ok(
                AlertResponse.from(alertGenerator.resolve(alertId, request.getResolvedBy())));
    }

    @GetMapping("/campaigns/{campaignId}/adjustments")
    public ResponseEntity<List<AdjustmentResponse>> getAdjustments(
            @PathVariable String campaignId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(queryService.getAdjustments(campaignId, limit));
    }

    @GetMapping("/approvals/pending")
    @Operation(summary = "Adjustments waiting for operator sign-off, oldest first")
    public ResponseEntity<List<AdjustmentResponse>> getPendingApprovals() {
        return ResponseEntity.ok(queryService.getPendingApprovals());
    }

    @PostMapping("/adjustments/{adjustmentId}/approve")
    @Operation(
            summary = "Approve a pending adjustment",
            responses = {
                @ApiResponse(responseCode = "200", description = "Approved, commit queued"),
                @ApiResponse(responseCode = "409", description = "Expired or already decided")
            })
    public ResponseEntity<AdjustmentResponse> approve(
            @PathVariable Long adjustmentId, @Valid @RequestBody ApprovalDecisionRequest request) {
        return ResponseEntity.ok(
                AdjustmentResponse.from(
                        approvalGate.approve(adjustmentId, request.getActor(), request.getNote())));
    }

    @PostMapping("/adjustments/{adjustmentId}/reject")
    public ResponseEntity<AdjustmentResponse> reject(
            @PathVariable Long adjustmentId, @Valid @RequestBody ApprovalDecisionRequest request) {
        return ResponseEntity.ok(
                AdjustmentResponse.from(
                        approvalGate.reject(adjustmentId, request.getActor(), request.getNote())));
    }

    @PostMapping("/spend")
    @Operation(summary = "Push a spend figure; duplicates of a filled bucket are dropped")
    public ResponseEntity<Map<String, Object>> pushSpend(@Valid @RequestBody SpendReport report) {
        boolean recorded = spendIngestion.record(report, SnapshotSource.PUSH).isPresent();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("campaignId", report.getCampaignId(), "recorded", recorded));
    }

    @GetMapping("/campaigns/{campaignId}/recommendations")
    public ResponseEntity<RecommendationResponse> getRecommendations(
            @PathVariable String campaignId) {
        return ResponseEntity.ok(queryService.getRecommendations(campaignId));
    }

    @GetMapping("/overview")
    public ResponseEntity<OverviewResponse> getOverview() {
        return ResponseEntity.ok(queryService.getOverview());
    }

    @PostMapping("/campaigns/{campaignId}/evaluate")
    @Operation(summary = "Run the current monitoring cycle for one campaign now")
    public ResponseEntity<Map<String, Object>> evaluate(@PathVariable String campaignId) {
        EvaluationOutcome outcome = evaluationService.evaluate(campaignId);
        return ResponseEntity.ok(Map.of("campaignId", campaignId, "outcome", outcome));
    }
}
