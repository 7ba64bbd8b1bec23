package com.skillpilot.runtime.skill;

/**
 * Skill instructions as returned by a {@link SkillSource}.
 *
 * @param content         Instruction text inserted into the agent context on activation.
 * @param declaredVersion Version the source vouches for, or null to fall back to the
 *                        content's {@code version:} marker.
 */
public record SkillContent(String content, String declaredVersion) {

    public SkillContent {
        if (content == null) {
            throw new IllegalArgumentException("Skill content must not be null");
        }
    }

    /**
     * Version to track for this content: the declared one, else the content
     * marker, else {@link SkillVersion#DEFAULT}.
     *
     * @throws IllegalArgumentException if the declared version is malformed
     */
    public SkillVersion resolveVersion() {
        if (declaredVersion != null && !declaredVersion.isBlank()) {
            return SkillVersion.parse(declaredVersion);
        }
        return SkillVersion.fromContent(content).orElse(SkillVersion.DEFAULT);
    }
}
