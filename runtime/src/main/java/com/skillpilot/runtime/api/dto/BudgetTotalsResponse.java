package com.skillpilot.runtime.api.dto;

/** Response body for GET /budgets/totals. */
public record BudgetTotalsResponse(
        int totalBudget,
        int allocated,
        int used,
        int available) {}
