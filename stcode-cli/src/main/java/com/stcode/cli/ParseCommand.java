package com.stcode.cli;

import com.stcode.core.ast.DeclarationBearing;
import com.stcode.core.batch.BatchParser;
import com.stcode.core.batch.BatchResult;
import com.stcode.core.batch.ItemOutcome;
import com.stcode.core.config.ConfigLoader;
import com.stcode.core.config.StcodeConfig;
import com.stcode.core.index.DeclarationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Parses Structured Text files and reports the result per file.
 *
 * <p>Every file that parses is listed with the units it declares and the number of
 * variables each unit has. Files that fail are listed with the failure reason. The
 * exit code is {@code 0} only when every file parsed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stcode parse src/Motor.st src/lib
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse Structured Text files and report declarations and failures",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

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

    @Override
    public Integer call() {
        try {
            StcodeConfig config = ConfigLoader.load(configPath);
            List<SourceFiles.SourceFile> files = SourceFiles.collect(paths, config.batch());
            if (files.isEmpty()) {
                System.out.println("No source files found");
                return 0;
            }

            log.info("Parsing {} files", files.size());
            BatchResult result = new BatchParser().parseAll(SourceFiles.read(files));

            for (ItemOutcome outcome : result.outcomes()) {
                if (outcome.success()) {
                    System.out.println("✓ " + outcome.item().filename());
                    printUnits(outcome);
                } else {
                    System.out.println("✗ " + outcome.item().filename());
                }
            }

            System.out.println();
            if (result.success()) {
                System.out.println("✓ Parsed " + result.outcomes().size() + " files");
                return 0;
            }

            System.out.println("✗ " + result.failures().size() + " of " + result.outcomes().size() + " files failed:");
            result.failures().forEach(f -> System.out.println(f.describeFailure()));
            return 1;

        } catch (Exception e) {
            log.error("Parse failed", e);
            System.err.println("✗ Parse failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printUnits(ItemOutcome outcome) {
        for (DeclarationBearing unit : outcome.parsed().root().declarationBearingUnits()) {
            DeclarationIndex index = DeclarationIndex.of(unit);
            System.out.println("    " + unit.name() + " (" + index.size() + " variables)");
        }
    }
}
