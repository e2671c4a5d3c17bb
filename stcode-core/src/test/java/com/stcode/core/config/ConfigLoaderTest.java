package com.stcode.core.config;

import com.stcode.core.render.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validConfig_readsAllSections() throws IOException {
        Path configFile = tempDir.resolve("stcode.yaml");
        Files.writeString(configFile, """
            format:
              indent: 2
              blankLineBetweenItems: false

            batch:
              keepPartialResults: true
              extensions:
                - .st
                - .EXP
            """);

        StcodeConfig config = ConfigLoader.load(configFile);

        assertThat(config.format().indent()).isEqualTo(2);
        assertThat(config.format().blankLineBetweenItems()).isFalse();
        assertThat(config.batch().keepPartialResults()).isTrue();
        assertThat(config.batch().extensions()).containsExactly(".st", ".EXP");
        assertThat(config.renderContext()).isEqualTo(new RenderContext("  ", false));
    }

    @Test
    void load_partialConfig_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("stcode.yaml");
        Files.writeString(configFile, """
            format:
              indent: 0
            unknown:
              key: value
            """);

        StcodeConfig config = ConfigLoader.load(configFile);

        assertThat(config.format().indent()).isEqualTo(4);
        assertThat(config.format().blankLineBetweenItems()).isTrue();
        assertThat(config.batch()).isEqualTo(StcodeConfig.BatchConfig.defaults());
        assertThat(config.renderContext()).isEqualTo(RenderContext.defaults());
    }

    @Test
    void load_missingFile_returnsDefaults() {
        StcodeConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(StcodeConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(StcodeConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, "format: [unclosed\n  indent: {");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(StcodeConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(StcodeConfig.defaults());
    }

    @Test
    void accepts_matchesExtensionIgnoringCase() {
        StcodeConfig.BatchConfig batch = new StcodeConfig.BatchConfig(false, List.of(".st", ".exp"));

        assertThat(batch.accepts("Main.ST")).isTrue();
        assertThat(batch.accepts("lib/Types.exp")).isTrue();
        assertThat(batch.accepts("notes.txt")).isFalse();
        assertThat(StcodeConfig.BatchConfig.defaults().accepts("a.st")).isTrue();
    }
}
