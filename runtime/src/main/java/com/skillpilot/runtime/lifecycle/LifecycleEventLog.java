package com.skillpilot.runtime.lifecycle;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only, ordered record of lifecycle transitions.
 *
 * The log is the only source of historical ordering: eviction picks the
 * oldest activation from it and rollback finds prior versions in it.
 *
 * Not thread-safe on its own; {@link SkillLifecycleManager} appends and reads
 * under its lock.
 */
public class LifecycleEventLog {

    private final List<LifecycleEvent> events = new ArrayList<>();
    private final Clock clock;
    private long nextSequence = 1;

    public LifecycleEventLog(Clock clock) {
        this.clock = clock;
    }

    public LifecycleEvent append(String skillName,
                                 LifecycleEventType type,
                                 SkillState oldState,
                                 SkillState newState,
                                 String version,
                                 Map<String, Object> metadata) {
        LifecycleEvent event = new LifecycleEvent(
                nextSequence++, skillName, type, clock.instant(),
                oldState, newState, version, metadata);
        events.add(event);
        return event;
    }

    public List<LifecycleEvent> all() {
        return List.copyOf(events);
    }

    public List<LifecycleEvent> forSkill(String skillName) {
        return events.stream()
                .filter(e -> e.skillName().equals(skillName))
                .toList();
    }

    /** Most recent event of the given type for a skill. */
    public Optional<LifecycleEvent> latest(String skillName, LifecycleEventType type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            LifecycleEvent e = events.get(i);
            if (e.type() == type && e.skillName().equals(skillName)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** First event of the given type for a skill. */
    public Optional<LifecycleEvent> earliest(String skillName, LifecycleEventType type) {
        return events.stream()
                .filter(e -> e.type() == type && e.skillName().equals(skillName))
                .findFirst();
    }

    /**
     * The {@code steps}-th most recent event of a type for a skill
     * (1 = latest).
     */
    public Optional<LifecycleEvent> nthLatest(String skillName, LifecycleEventType type, int steps) {
        int seen = 0;
        for (int i = events.size() - 1; i >= 0; i--) {
            LifecycleEvent e = events.get(i);
            if (e.type() == type && e.skillName().equals(skillName) && ++seen == steps) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public long count(String skillName, LifecycleEventType type) {
        return events.stream()
                .filter(e -> e.type() == type && e.skillName().equals(skillName))
                .count();
    }

    public int size() {
        return events.size();
    }
}
