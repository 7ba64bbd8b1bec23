package com.skillpilot.runtime.api.dto;

/** Response body for POST /budgets/{name}. */
public record AllocateResponse(String skill, int requested, int granted, int priority) {}
