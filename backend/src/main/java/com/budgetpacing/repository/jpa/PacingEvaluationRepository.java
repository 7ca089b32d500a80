package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.EvaluationOutcome;
import com.budgetpacing.entity.PacingEvaluation;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PacingEvaluationRepository extends JpaRepository<PacingEvaluation, Long> {

    boolean existsByCampaignIdAndEvaluationBucket(String campaignId, Long evaluationBucket);

    Optional<PacingEvaluation> findByCampaignIdAndEvaluationBucket(
            String campaignId, Long evaluationBucket);

    /** Recent evaluations of the given outcome, newest first */
    List<PacingEvaluation> findByCampaignIdAndOutcomeOrderByEvaluationBucketDesc(
            String campaignId, EvaluationOutcome outcome, Pageable pageable);

    /** Latest evaluation of the plan, whatever the outcome */
    Optional<PacingEvaluation> findFirstByCampaignIdAndOutcomeOrderByEvaluationBucketDesc(
            String campaignId, EvaluationOutcome outcome);
}
