package com.skillpilot.runtime.api.dto;

/** Body of POST /skills/{name}/upgrade. */
public record UpgradeRequest(String version) {}
