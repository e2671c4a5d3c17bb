package com.stcode.cli;

import com.stcode.StcodeCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the {@code parse} and {@code format} subcommands.
 */
class CommandsTest {

    private static final String VALID = "program Main\nvar\n  x : INT;\nend_var\nx:=x+1;\nend_program\n";
    private static final String INVALID = "PROGRAM Broken\nx := ;\nEND_PROGRAM\n";

    @TempDir
    Path tempDir;

    private Path sources;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        sources = Files.createDirectories(tempDir.resolve("src"));
        config = tempDir.resolve("missing.yaml");
        Files.writeString(sources.resolve("Main.st"), VALID);
        Files.writeString(sources.resolve("notes.txt"), "not structured text");
    }

    @Test
    void parse_validDirectory_returnsZero() {
        int exitCode = execute("parse", sources.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void parse_invalidFile_returnsOne() throws IOException {
        Files.writeString(sources.resolve("Broken.st"), INVALID);

        int exitCode = execute("parse", sources.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void parse_missingPath_returnsOne() {
        int exitCode = execute("parse", tempDir.resolve("nope.st").toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void format_withOutput_writesNormalizedFile() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", sources.toString(), "-c", config.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("Main.st")).hasContent(
            "PROGRAM Main\n    VAR\n        x : INT;\n    END_VAR\n    x := x + 1;\nEND_PROGRAM\n");
        assertThat(out.resolve("notes.txt")).doesNotExist();
    }

    @Test
    void format_failureWithoutKeepPartial_writesNothing() throws IOException {
        Files.writeString(sources.resolve("Broken.st"), INVALID);
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", sources.toString(), "-c", config.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void format_failureWithKeepPartial_writesParsedFiles() throws IOException {
        Files.writeString(sources.resolve("Broken.st"), INVALID);
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", sources.toString(), "-c", config.toString(), "-o", out.toString(),
            "--keep-partial");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.resolve("Main.st")).exists();
        assertThat(out.resolve("Broken.st")).doesNotExist();
    }

    @Test
    void format_keepPartialFromConfig_writesParsedFiles() throws IOException {
        Files.writeString(sources.resolve("Broken.st"), INVALID);
        Path configFile = tempDir.resolve("stcode.yaml");
        Files.writeString(configFile, "format:\n  indent: 2\nbatch:\n  keepPartialResults: true\n");
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", sources.toString(), "-c", configFile.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.resolve("Main.st")).content().startsWith("PROGRAM Main\n  VAR\n    x : INT;");
    }

    @Test
    void format_sameNameInSubdirectories_keepsRelativePaths() throws IOException {
        Files.writeString(Files.createDirectories(sources.resolve("a")).resolve("Main.st"), "PROGRAM A\nEND_PROGRAM\n");
        Files.writeString(Files.createDirectories(sources.resolve("b")).resolve("Main.st"), "PROGRAM B\nEND_PROGRAM\n");
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", sources.toString(), "-c", config.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("a").resolve("Main.st")).hasContent("PROGRAM A\nEND_PROGRAM\n");
        assertThat(out.resolve("b").resolve("Main.st")).hasContent("PROGRAM B\nEND_PROGRAM\n");
        assertThat(out.resolve("Main.st")).exists();
    }

    @Test
    void format_filesSharingOutputName_failsWithoutWriting() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("one")).resolve("Main.st");
        Path second = Files.createDirectories(tempDir.resolve("two")).resolve("Main.st");
        Files.writeString(first, "PROGRAM One\nEND_PROGRAM\n");
        Files.writeString(second, "PROGRAM Two\nEND_PROGRAM\n");
        Path out = tempDir.resolve("out");

        int exitCode = execute("format", first.toString(), second.toString(), "-c", config.toString(),
            "-o", out.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void root_withoutSubcommand_returnsZero() {
        assertThat(execute("--quiet")).isZero();
    }

    private int execute(String... args) {
        return StcodeCLI.commandLine().execute(args);
    }
}
