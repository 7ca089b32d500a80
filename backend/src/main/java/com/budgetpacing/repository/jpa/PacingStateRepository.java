package com.budgetpacing.repository.jpa;

import com.budgetpacing.entity.PacingPhase;
import com.budgetpacing.entity.PacingState;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface PacingStateRepository extends JpaRepository<PacingState, String> {

    List<PacingState> findByPhase(PacingPhase phase);

    /** Campaign count per phase for the portfolio overview */
    @Query("SELECT s.phase, COUNT(s) FROM PacingState s GROUP BY s.phase")
    List<Object[]> countByPhase();
}
