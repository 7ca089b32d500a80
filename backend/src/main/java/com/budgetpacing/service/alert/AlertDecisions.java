package com.budgetpacing.service.alert;

import com.budgetpacing.entity.AlertType;
import java.util.List;
import java.util.Set;

public record AlertDecisions(List<AlertRequest> toRaise, Set<AlertType> toResolve) {}
