package com.skillpilot.runtime.skill;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FileSystemSkillSource against a throwaway skills directory.
 */
class FileSystemSkillSourceTest {

    @TempDir Path skillsDir;

    FileSystemSkillSource source;

    @BeforeEach
    void setUp() throws IOException {
        Path reflection = Files.createDirectories(skillsDir.resolve("reflection"));
        Files.writeString(reflection.resolve("SKILL.md"), "---\nversion: 1.2.0\n---\nReflect carefully.");
        Path prompts = Files.createDirectories(reflection.resolve("prompts"));
        Files.writeString(prompts.resolve("b_critique.md"), "Critique the draft.");
        Files.writeString(prompts.resolve("a_summary.md"), "Summarise the draft.");
        Files.writeString(prompts.resolve("notes.txt"), "ignored");

        Path v110 = Files.createDirectories(reflection.resolve("v1.1.0"));
        Files.writeString(v110.resolve("SKILL.md"), "---\nversion: 1.1.0\n---\nOlder instructions.");

        source = new FileSystemSkillSource(skillsDir);
    }

    @Test
    void fetch_currentVersion_readsSkillFileAndPromptsInOrder() {
        SkillContent content = source.fetch("reflection", null).orElseThrow();

        assertThat(content.content())
                .startsWith("---\nversion: 1.2.0")
                .contains("\n\n## Prompt: a_summary\nSummarise the draft.")
                .contains("\n\n## Prompt: b_critique\nCritique the draft.")
                .doesNotContain("ignored");
        assertThat(content.content().indexOf("a_summary"))
                .isLessThan(content.content().indexOf("b_critique"));
        assertThat(content.declaredVersion()).isEqualTo("1.2.0");
    }

    @Test
    void fetch_versionedDirectory_isPreferred() {
        SkillContent content = source.fetch("reflection", "1.1.0").orElseThrow();

        assertThat(content.content()).contains("Older instructions.");
        assertThat(content.resolveVersion()).isEqualTo(new SkillVersion(1, 1, 0));
    }

    @Test
    void fetch_unknownVersion_fallsBackToSkillRoot() {
        SkillContent content = source.fetch("reflection", "1.9.0").orElseThrow();

        assertThat(content.declaredVersion()).isEqualTo("1.2.0");
    }

    @Test
    void fetch_unknownSkill_isEmpty() {
        assertThat(source.fetch("planner", null)).isEmpty();
    }

    @Test
    void fetch_directoryWithoutSkillFile_isEmpty() throws IOException {
        Files.createDirectories(skillsDir.resolve("empty"));

        assertThat(source.fetch("empty", null)).isEmpty();
    }

    @Test
    void fetch_pathTraversal_isRejected() throws IOException {
        Path nested = Files.createDirectories(skillsDir.resolve("reflection").resolve("inner"));
        Files.writeString(nested.resolve("SKILL.md"), "hidden");

        assertThat(source.fetch("reflection/inner", null)).isEmpty();
        assertThat(source.fetch("../reflection", null)).isEmpty();
        assertThat(source.fetch("..", null)).isEmpty();
        assertThat(source.fetch("a\\b", null)).isEmpty();
        assertThat(source.fetch(" ", null)).isEmpty();
    }

    @Test
    void fetch_noVersionMarker_declaresNothing() throws IOException {
        Path plain = Files.createDirectories(skillsDir.resolve("plain"));
        Files.writeString(plain.resolve("SKILL.md"), "No front matter here.");

        SkillContent content = source.fetch("plain", null).orElseThrow();

        assertThat(content.declaredVersion()).isNull();
        assertThat(content.resolveVersion()).isEqualTo(SkillVersion.DEFAULT);
    }
}
