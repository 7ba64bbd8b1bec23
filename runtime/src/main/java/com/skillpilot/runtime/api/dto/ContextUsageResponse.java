package com.skillpilot.runtime.api.dto;

import java.util.Map;

/** Response body for GET /lifecycle/context. */
public record ContextUsageResponse(
        Map<String, Integer> usage,
        int available,
        int contextBudget) {}
