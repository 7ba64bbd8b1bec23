package com.skillpilot.runtime.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.skillpilot.runtime.lifecycle.LifecycleResult;
import com.skillpilot.runtime.lifecycle.SkillState;

/**
 * Response body of every lifecycle mutation. {@code content} is only set by a
 * successful activation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LifecycleResponse(
        String  skill,
        boolean success,
        String  state,
        String  version,
        String  error,
        String  detail,
        String  content) {

    public static LifecycleResponse from(LifecycleResult result, SkillState state, String version) {
        return new LifecycleResponse(
                result.skillName(),
                result.success(),
                state.name(),
                version,
                result.failure() == null ? null : result.failure().name(),
                result.detail(),
                result.content());
    }
}
