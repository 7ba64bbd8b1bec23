package com.skillpilot.runtime.lifecycle;

/**
 * Residency of a skill.
 *
 * Transitions:
 *   DISCOVERED → LOADED   (load)
 *   LOADED     → ACTIVE   (activate)
 *   ACTIVE     → LOADED   (deactivate, eviction)
 *   LOADED     → UNLOADED (unload, eviction)
 *   UNLOADED   → LOADED   (load)
 *
 * Any load attempt can end in ERROR; the only way out of ERROR is a fresh load.
 */
public enum SkillState {
    DISCOVERED,     // Known by name only; default for names never loaded
    LOADED,         // Content in memory, not contributing to the agent context
    ACTIVE,         // Content in the agent context, holds a token allocation
    UNLOADED,       // Content dropped
    ERROR;          // Last load failed

    /** True for states that hold content in memory. */
    public boolean isResident() {
        return this == LOADED || this == ACTIVE;
    }
}
