package com.skillpilot.runtime.api.dto;

/**
 * Body of POST /skills/{name}/activate. Both fields are optional: no
 * allocation means the configured default, a priority routes the request
 * through the budget allocator.
 */
public record ActivateRequest(Integer allocation, Integer priority) {}
