package com.skillpilot.runtime.skill;

public class SkillNotFoundException extends SkillException {
    public SkillNotFoundException(String name) {
        super(Kind.NOT_FOUND, "No skill content found for: '" + name + "'");
    }

    public SkillNotFoundException(String name, String version) {
        super(Kind.NOT_FOUND, "No skill content found for: '" + name + "' v" + version);
    }
}
