package com.skillpilot.runtime.lifecycle;

import java.time.Duration;

/**
 * Capacity and budget limits of a {@link SkillLifecycleManager}.
 *
 * @param maxLoadedSkills   Skills held in memory (LOADED or ACTIVE) at once.
 * @param maxActiveSkills   Skills contributing to the agent context at once.
 * @param contextBudget     Tokens shared by all active skills.
 * @param defaultAllocation Tokens given to an activation that does not ask for a specific amount.
 * @param fetchTimeout      Upper bound on one skill source fetch.
 */
public record LifecycleLimits(
        int      maxLoadedSkills,
        int      maxActiveSkills,
        int      contextBudget,
        int      defaultAllocation,
        Duration fetchTimeout) {

    public static final int DEFAULT_MAX_LOADED = 20;
    public static final int DEFAULT_MAX_ACTIVE = 5;
    public static final int DEFAULT_CONTEXT_BUDGET = 10_000;
    public static final int DEFAULT_ALLOCATION = 2_000;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    public LifecycleLimits {
        requirePositive("maxLoadedSkills", maxLoadedSkills);
        requirePositive("maxActiveSkills", maxActiveSkills);
        requirePositive("contextBudget", contextBudget);
        requirePositive("defaultAllocation", defaultAllocation);
        if (defaultAllocation > contextBudget) {
            throw new IllegalArgumentException("defaultAllocation (" + defaultAllocation
                    + ") exceeds contextBudget (" + contextBudget + ")");
        }
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive, got " + fetchTimeout);
        }
    }

    public static LifecycleLimits defaults() {
        return new LifecycleLimits(DEFAULT_MAX_LOADED, DEFAULT_MAX_ACTIVE,
                DEFAULT_CONTEXT_BUDGET, DEFAULT_ALLOCATION, DEFAULT_FETCH_TIMEOUT);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
