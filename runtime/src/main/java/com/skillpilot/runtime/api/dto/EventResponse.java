package com.skillpilot.runtime.api.dto;

import com.skillpilot.runtime.lifecycle.LifecycleEvent;

import java.time.Instant;
import java.util.Map;

/** One lifecycle event as returned by GET /lifecycle/events. */
public record EventResponse(
        long    sequence,
        String  skill,
        String  type,
        Instant timestamp,
        String  oldState,
        String  newState,
        String  version,
        Map<String, Object> metadata) {

    public static EventResponse from(LifecycleEvent e) {
        return new EventResponse(
                e.sequence(),
                e.skillName(),
                e.type().name(),
                e.timestamp(),
                e.oldState() == null ? null : e.oldState().name(),
                e.newState() == null ? null : e.newState().name(),
                e.version(),
                e.metadata());
    }
}
