package com.skillpilot.runtime.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads skill packages from a directory tree.
 *
 * <pre>
 *   skills/
 *     reflection/
 *       SKILL.md            current version
 *       prompts/*.md        appended as "## Prompt: &lt;stem&gt;" sections
 *       v1.1.0/
 *         SKILL.md          explicitly versioned copy
 *         prompts/*.md
 * </pre>
 *
 * A requested version resolves to the {@code v<version>} subdirectory when it
 * exists, otherwise to the skill's root directory.
 */
public class FileSystemSkillSource implements SkillSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSkillSource.class);

    static final String SKILL_FILE = "SKILL.md";
    static final String PROMPTS_DIR = "prompts";

    private final Path skillsDir;

    public FileSystemSkillSource(Path skillsDir) {
        this.skillsDir = skillsDir.toAbsolutePath().normalize();
    }

    public Path getSkillsDir() { return skillsDir; }

    @Override
    public Optional<SkillContent> fetch(String name, String version) {
        Optional<Path> dir = resolve(name, version);
        if (dir.isEmpty()) {
            log.debug("Skill '{}' not found under {}", name, skillsDir);
            return Optional.empty();
        }
        Path skillFile = dir.get().resolve(SKILL_FILE);
        if (!Files.isRegularFile(skillFile)) {
            log.debug("Skill '{}' has no {} in {}", name, SKILL_FILE, dir.get());
            return Optional.empty();
        }

        try {
            StringBuilder content = new StringBuilder(Files.readString(skillFile, StandardCharsets.UTF_8));
            for (Path prompt : promptFiles(dir.get().resolve(PROMPTS_DIR))) {
                String stem = prompt.getFileName().toString().replaceFirst("\\.md$", "");
                content.append("\n\n## Prompt: ").append(stem).append('\n')
                       .append(Files.readString(prompt, StandardCharsets.UTF_8));
            }
            String text = content.toString();
            String declared = SkillVersion.fromContent(text).map(SkillVersion::toString).orElse(null);
            log.debug("Read skill '{}' from {} ({} chars)", name, dir.get(), text.length());
            return Optional.of(new SkillContent(text, declared));
        } catch (IOException e) {
            throw new SkillException(SkillException.Kind.SOURCE_ERROR,
                    "Failed to read skill '" + name + "' from " + dir.get(), e);
        }
    }

    private Optional<Path> resolve(String name, String version) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            return Optional.empty();
        }
        Path base = skillsDir.resolve(name).normalize();
        if (!base.startsWith(skillsDir)) {
            return Optional.empty();
        }
        if (version != null && !version.isBlank()) {
            Path versioned = base.resolve("v" + version.trim());
            if (Files.isDirectory(versioned)) {
                return Optional.of(versioned);
            }
        }
        return Files.isDirectory(base) ? Optional.of(base) : Optional.empty();
    }

    private static List<Path> promptFiles(Path promptsDir) throws IOException {
        List<Path> prompts = new ArrayList<>();
        if (!Files.isDirectory(promptsDir)) {
            return prompts;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(promptsDir, "*.md")) {
            for (Path p : stream) {
                prompts.add(p);
            }
        }
        prompts.sort(null);
        return prompts;
    }
}
