package com.skillpilot.runtime.lifecycle;

import com.skillpilot.runtime.skill.SkillException;

import java.util.Optional;

/**
 * Outcome of a lifecycle operation. Expected failures are reported here rather
 * than thrown, so batch callers (activating several skills) can carry on past
 * individual failures.
 *
 * @param skillName Skill the operation targeted.
 * @param success   Whether the operation took effect (or was a legal no-op).
 * @param failure   Failure category; null on success.
 * @param detail    Human-readable failure detail; null on success.
 * @param content   Skill instructions, set only by a successful activate.
 */
public record LifecycleResult(
        String              skillName,
        boolean             success,
        SkillException.Kind failure,
        String              detail,
        String              content) {

    public static LifecycleResult ok(String skillName) {
        return new LifecycleResult(skillName, true, null, null, null);
    }

    public static LifecycleResult activated(String skillName, String content) {
        return new LifecycleResult(skillName, true, null, null, content);
    }

    public static LifecycleResult failed(String skillName, SkillException.Kind kind, String detail) {
        return new LifecycleResult(skillName, false, kind, detail, null);
    }

    public static LifecycleResult failed(String skillName, SkillException e) {
        return failed(skillName, e.getKind(), e.getMessage());
    }

    public boolean isFailure() { return !success; }

    public Optional<String> contentIfActive() {
        return Optional.ofNullable(content);
    }
}
