package com.skillpilot.runtime.api.dto;

/** Response body for GET /skills/{name}. */
public record SkillStatusResponse(
        String  name,
        String  state,
        String  version,
        Integer contextAllocation) {}
