package com.skillpilot.runtime.api.dto;

/** Body of POST /budgets/{name}/use. */
public record UseRequest(int tokens) {}
