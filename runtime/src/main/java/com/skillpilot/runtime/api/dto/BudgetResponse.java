package com.skillpilot.runtime.api.dto;

import com.skillpilot.runtime.budget.SkillBudget;

/** One skill's budget as returned by the /budgets endpoints. */
public record BudgetResponse(
        String skill,
        int    allocated,
        int    used,
        int    remaining,
        double utilization,
        int    priority) {

    public static BudgetResponse from(SkillBudget b) {
        return new BudgetResponse(b.skillName(), b.allocated(), b.used(), b.remaining(), b.utilization(), b.priority());
    }
}
