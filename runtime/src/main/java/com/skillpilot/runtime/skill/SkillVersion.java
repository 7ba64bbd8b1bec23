package com.skillpilot.runtime.skill;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version of a skill: MAJOR.MINOR.PATCH.
 *
 * Two versions are compatible when they share a major version. Hot-reload
 * upgrades and rollbacks are only allowed between compatible versions.
 *
 * @param major breaking changes
 * @param minor backward-compatible additions
 * @param patch fixes
 */
public record SkillVersion(int major, int minor, int patch) implements Comparable<SkillVersion> {

    /** Version assumed when skill content carries no version marker. */
    public static final SkillVersion DEFAULT = new SkillVersion(1, 0, 0);

    private static final Pattern VERSION = Pattern.compile("v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    // Matches the "version: 1.2.3" line of a SKILL.md front matter, quoted or not.
    private static final Pattern VERSION_MARKER = Pattern.compile(
            "version:\\s*[\"']?(\\d+\\.\\d+\\.\\d+)[\"']?");

    public SkillVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    "Version parts must be non-negative: " + major + "." + minor + "." + patch);
        }
    }

    /**
     * Parse "1", "1.2", "1.2.3" (optionally prefixed with "v"). Missing parts
     * default to 0.
     *
     * @throws IllegalArgumentException if the text is not a version
     */
    public static SkillVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher m = VERSION.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a version: '" + text + "'");
        }
        try {
            return new SkillVersion(
                    Integer.parseInt(m.group(1)),
                    m.group(2) == null ? 0 : Integer.parseInt(m.group(2)),
                    m.group(3) == null ? 0 : Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version part out of range: '" + text + "'", e);
        }
    }

    /** Finds the {@code version:} marker in skill content, if any. */
    public static Optional<SkillVersion> fromContent(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher m = VERSION_MARKER.matcher(content);
        return m.find() ? Optional.of(parse(m.group(1))) : Optional.empty();
    }

    public boolean isCompatible(SkillVersion other) {
        return other != null && major == other.major;
    }

    @Override
    public int compareTo(SkillVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
