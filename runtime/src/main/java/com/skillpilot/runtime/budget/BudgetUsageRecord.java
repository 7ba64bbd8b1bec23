package com.skillpilot.runtime.budget;

import java.time.Instant;

/** Final figures of a released budget, kept for usage analysis. */
public record BudgetUsageRecord(
        String  skillName,
        int     allocated,
        int     used,
        double  utilization,
        Instant releasedAt) {}
