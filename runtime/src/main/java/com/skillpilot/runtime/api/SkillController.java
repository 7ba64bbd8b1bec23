package com.skillpilot.runtime.api;

import com.skillpilot.runtime.api.dto.ActivateRequest;
import com.skillpilot.runtime.api.dto.LifecycleResponse;
import com.skillpilot.runtime.api.dto.SkillStatusResponse;
import com.skillpilot.runtime.api.dto.UpgradeRequest;
import com.skillpilot.runtime.lifecycle.LifecycleResult;
import com.skillpilot.runtime.lifecycle.SkillLifecycleManager;
import com.skillpilot.runtime.skill.SkillVersion;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin API over the skill lifecycle.
 *
 * POST /skills/{name}/load        — load (optionally ?version=1.2.0)
 * POST /skills/{name}/unload      — unload
 * POST /skills/{name}/activate    — activate, body {allocation?, priority?}
 * POST /skills/{name}/deactivate  — deactivate
 * POST /skills/{name}/upgrade     — hot-reload at another version, body {version}
 * POST /skills/{name}/rollback    — back to the version before an upgrade (?steps=1)
 * GET  /skills/{name}             — state, version, allocation
 *
 * Everything under /skills is per skill, so any skill name is addressable;
 * context usage and the event log live in {@link LifecycleController}.
 */
@RestController
@RequestMapping("/skills")
public class SkillController {

    private final SkillLifecycleManager lifecycle;

    public SkillController(SkillLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @PostMapping("/{name}/load")
    public ResponseEntity<LifecycleResponse> load(@PathVariable String name,
                                                  @RequestParam(required = false) String version) {
        return respond(lifecycle.load(name, version));
    }

    @PostMapping("/{name}/unload")
    public ResponseEntity<LifecycleResponse> unload(@PathVariable String name) {
        return respond(lifecycle.unload(name));
    }

    /**
     * Activate a skill and return its instructions.
     *
     * Example:
     *   curl -X POST http://localhost:8080/skills/reflection/activate \
     *     -H "Content-Type: application/json" -d '{"allocation":1500,"priority":2}'
     */
    @PostMapping("/{name}/activate")
    public ResponseEntity<LifecycleResponse> activate(@PathVariable String name,
                                                      @RequestBody(required = false) ActivateRequest req) {
        Integer allocation = req == null ? null : req.allocation();
        Integer priority   = req == null ? null : req.priority();
        if (priority == null) {
            return respond(lifecycle.activate(name, allocation));
        }
        int tokens = allocation == null ? lifecycle.getLimits().defaultAllocation() : allocation;
        return respond(lifecycle.activate(name, tokens, priority));
    }

    @PostMapping("/{name}/deactivate")
    public ResponseEntity<LifecycleResponse> deactivate(@PathVariable String name) {
        return respond(lifecycle.deactivate(name));
    }

    @PostMapping("/{name}/upgrade")
    public ResponseEntity<LifecycleResponse> upgrade(@PathVariable String name,
                                                     @RequestBody UpgradeRequest req) {
        return respond(lifecycle.upgrade(name, req.version()));
    }

    @PostMapping("/{name}/rollback")
    public ResponseEntity<LifecycleResponse> rollback(@PathVariable String name,
                                                      @RequestParam(defaultValue = "1") int steps) {
        return respond(lifecycle.rollback(name, steps));
    }

    @GetMapping("/{name}")
    public SkillStatusResponse status(@PathVariable String name) {
        return new SkillStatusResponse(
                name,
                lifecycle.getState(name).name(),
                lifecycle.getVersion(name).map(SkillVersion::toString).orElse(null),
                lifecycle.getContextUsage().get(name));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ResponseEntity<LifecycleResponse> respond(LifecycleResult result) {
        String name = result.skillName();
        LifecycleResponse body = LifecycleResponse.from(result,
                lifecycle.getState(name),
                lifecycle.getVersion(name).map(SkillVersion::toString).orElse(null));
        return ResponseEntity.status(statusFor(result)).body(body);
    }

    static HttpStatus statusFor(LifecycleResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        return switch (result.failure()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INCOMPATIBLE_VERSION, NO_UPGRADE_HISTORY, BUDGET_EXCEEDED, CAPACITY_EXCEEDED -> HttpStatus.CONFLICT;
            case INVALID_VERSION, INVALID_ALLOCATION, INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UNSUPPORTED -> HttpStatus.NOT_IMPLEMENTED;
            case SOURCE_ERROR, UNEXPECTED_FAULT -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
