package com.stcode.cli;

import com.stcode.core.batch.BatchParser;
import com.stcode.core.batch.BatchResult;
import com.stcode.core.batch.ItemOutcome;
import com.stcode.core.config.ConfigLoader;
import com.stcode.core.config.StcodeConfig;
import com.stcode.core.render.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Parses Structured Text files and writes them back in normalized form.
 *
 * <p>Without {@code --output} the rendered source goes to standard output. With it, each
 * file is written under the output directory at its path relative to the directory
 * argument it was found in (bare file name for files named directly). Two inputs that
 * would write the same output file abort the command before anything is parsed.
 * When any file fails to parse nothing is written, unless partial results are kept
 * through {@code --keep-partial} or {@code batch.keepPartialResults}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stcode format src/Motor.st
 * stcode format src -o build/formatted --keep-partial
 * }</pre>
 */
@Command(
    name = "format",
    description = "Parse Structured Text files and write the normalized source",
    mixinStandardHelpOptions = true
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Parameters(
        arity = "1..*",
        description = "Source files or directories"
    )
    private List<Path> paths;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: stcode.yaml)"
    )
    private Path configPath = Paths.get("stcode.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: standard output)"
    )
    private Path outputDir;

    @Option(
        names = {"--keep-partial"},
        description = "Write files that parsed even when others failed (overrides config)"
    )
    private Boolean keepPartial;

    @Override
    public Integer call() {
        try {
            StcodeConfig config = ConfigLoader.load(configPath);
            List<SourceFiles.SourceFile> files = SourceFiles.collect(paths, config.batch());
            if (files.isEmpty()) {
                System.err.println("No source files found");
                return 0;
            }
            if (outputDir != null) {
                String collision = findCollision(files);
                if (collision != null) {
                    System.err.println("✗ " + collision);
                    System.err.println("Nothing written");
                    return 1;
                }
            }

            BatchResult result = new BatchParser().parseAll(SourceFiles.read(files));
            boolean keep = keepPartial != null ? keepPartial : config.batch().keepPartialResults();

            if (!result.success()) {
                System.err.println("✗ " + result.failures().size() + " of " + result.outcomes().size() + " files failed:");
                result.failures().forEach(f -> System.err.println(f.describeFailure()));
                if (!keep) {
                    System.err.println("Nothing written");
                    return 1;
                }
            }

            write(result.successes(), config.renderContext());
            return result.success() ? 0 : 1;

        } catch (Exception e) {
            log.error("Format failed", e);
            System.err.println("✗ Format failed: " + e.getMessage());
            return 1;
        }
    }

    private void write(List<ItemOutcome> outcomes, RenderContext context) throws IOException {
        if (outputDir == null) {
            for (ItemOutcome outcome : outcomes) {
                System.out.print(outcome.parsed().render(context));
            }
            return;
        }

        for (ItemOutcome outcome : outcomes) {
            Path target = outputDir.resolve(outcome.item().name());
            Files.createDirectories(target.getParent());
            Files.writeString(target, outcome.parsed().render(context), StandardCharsets.UTF_8);
            log.debug("Wrote {}", target);
            System.err.println("✓ " + target);
        }
        log.info("Formatted {} files into {}", outcomes.size(), outputDir);
    }

    /**
     * @return description of the first two inputs sharing an output file, or {@code null}
     */
    private String findCollision(List<SourceFiles.SourceFile> files) {
        Map<Path, Path> targets = new HashMap<>();
        for (SourceFiles.SourceFile file : files) {
            Path target = outputDir.resolve(file.relativePath()).normalize();
            Path previous = targets.putIfAbsent(target, file.path());
            if (previous != null) {
                return "Output collision: " + previous + " and " + file.path() + " both write " + target;
            }
        }
        return null;
    }
}
