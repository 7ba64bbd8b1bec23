package com.skillpilot.runtime.skill;

/**
 * Failure raised while resolving or governing a skill.
 *
 * Unchecked so it only crosses the skill source boundary. The lifecycle
 * manager and budget allocator catch it and report the {@link Kind} through
 * their result values; callers of those components never see it thrown.
 */
public class SkillException extends RuntimeException {

    public enum Kind {
        /** The skill source has no content for the requested name/version. */
        NOT_FOUND,
        /** The skill source failed while reading content. */
        SOURCE_ERROR,
        /** The skill source did not answer within the fetch timeout. */
        TIMEOUT,
        /** Upgrade/rollback target has a different major version. */
        INCOMPATIBLE_VERSION,
        INVALID_VERSION,
        INVALID_ALLOCATION,
        INVALID_ARGUMENT,
        /** Requested tokens cannot be granted even after eviction or reclaim. */
        BUDGET_EXCEEDED,
        /** Every loaded skill is active, nothing can be evicted. */
        CAPACITY_EXCEEDED,
        /** Rollback requested more steps than recorded upgrades. */
        NO_UPGRADE_HISTORY,
        UNSUPPORTED,
        UNEXPECTED_FAULT
    }

    private final Kind kind;

    public SkillException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SkillException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
