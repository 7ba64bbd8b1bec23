package com.skillpilot.runtime.lifecycle;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the lifecycle event log.
 *
 * @param sequence  Position in the log; strictly increasing, never reused.
 * @param skillName Skill the event concerns.
 * @param type      What happened.
 * @param timestamp Wall-clock time of the append (may tie; use {@code sequence} for order).
 * @param oldState  State before the transition.
 * @param newState  State after the transition.
 * @param version   Version involved, or null.
 * @param metadata  Event details, e.g. {@code context_allocation}, {@code from_version}, {@code error}.
 */
public record LifecycleEvent(
        long              sequence,
        String            skillName,
        LifecycleEventType type,
        Instant           timestamp,
        SkillState        oldState,
        SkillState        newState,
        String            version,
        Map<String, Object> metadata) {

    public static final String CONTEXT_ALLOCATION = "context_allocation";
    public static final String FROM_VERSION = "from_version";
    public static final String ERROR = "error";
    public static final String PRIORITY = "priority";
    public static final String RESIZED = "resized";
    public static final String REASON = "reason";

    public LifecycleEvent {
        // Null values are legal (from_version of a first upgrade), so no Map.copyOf.
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Object metadata(String key) {
        return metadata.get(key);
    }
}
