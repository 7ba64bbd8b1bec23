package com.skillpilot.runtime.api.dto;

/** Body of POST /budgets/{name}. Priority defaults to 1. */
public record AllocateRequest(int requested, Integer priority) {}
