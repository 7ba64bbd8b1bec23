package com.skillpilot.runtime.skill;

import java.util.Optional;

/**
 * Where skill content comes from (a directory of skill packages, a registry
 * service, ...). Called by the lifecycle manager during load and upgrade.
 *
 * Implementations may block on I/O; the manager never calls them while
 * holding its own lock.
 */
@FunctionalInterface
public interface SkillSource {

    /**
     * Fetch a skill's content.
     *
     * @param name    skill name
     * @param version requested version, or null for whatever the source considers current
     * @return the content, or empty if the source knows no such skill/version
     * @throws SkillException on read failures
     */
    Optional<SkillContent> fetch(String name, String version);
}
