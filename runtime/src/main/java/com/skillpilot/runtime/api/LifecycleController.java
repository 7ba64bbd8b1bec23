package com.skillpilot.runtime.api;

import com.skillpilot.runtime.api.dto.ContextUsageResponse;
import com.skillpilot.runtime.api.dto.EventResponse;
import com.skillpilot.runtime.lifecycle.SkillLifecycleManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only views across all skills.
 *
 * GET /lifecycle/context  — context usage by active skills
 * GET /lifecycle/events   — lifecycle event log (?skill= to filter)
 */
@RestController
@RequestMapping("/lifecycle")
public class LifecycleController {

    private final SkillLifecycleManager lifecycle;

    public LifecycleController(SkillLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @GetMapping("/context")
    public ContextUsageResponse context() {
        return new ContextUsageResponse(
                lifecycle.getContextUsage(),
                lifecycle.getAvailableBudget(),
                lifecycle.getLimits().contextBudget());
    }

    @GetMapping("/events")
    public List<EventResponse> events(@RequestParam(name = "skill", required = false) String skill) {
        return lifecycle.getEvents(skill).stream()
                .map(EventResponse::from)
                .toList();
    }
}
