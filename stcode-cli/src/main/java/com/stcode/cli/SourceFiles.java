package com.stcode.cli;

import com.stcode.core.batch.SourceItem;
import com.stcode.core.config.StcodeConfig.BatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands command line paths into batch items.
 *
 * <p>Files are taken as given. Directories are walked recursively and only files whose
 * extension is accepted by the batch configuration are picked up, in path order.
 * Each file keeps its path relative to the directory argument it was found under, or
 * its bare file name when it was named directly.
 */
final class SourceFiles {

    private static final Logger log = LoggerFactory.getLogger(SourceFiles.class);

    private SourceFiles() {
        // Utility class - no instantiation
    }

    /**
     * @param path file as found on disk
     * @param relativePath path below the directory argument, used to place output files
     */
    record SourceFile(Path path, Path relativePath) {
    }

    /**
     * Resolves the given paths to source files.
     *
     * @param paths files or directories
     * @param batch batch configuration providing accepted extensions
     * @return distinct source files in discovery order
     * @throws IOException if a path does not exist or a directory cannot be walked
     */
    static List<SourceFile> collect(List<Path> paths, BatchConfig batch) throws IOException {
        Map<Path, SourceFile> found = new LinkedHashMap<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    List<Path> files = walk
                        .filter(Files::isRegularFile)
                        .filter(p -> batch.accepts(p.getFileName().toString()))
                        .sorted()
                        .collect(Collectors.toList());
                    log.debug("Found {} source files in {}", files.size(), path);
                    files.forEach(f -> found.putIfAbsent(f.normalize(), new SourceFile(f, path.relativize(f))));
                }
            } else if (Files.isRegularFile(path)) {
                found.putIfAbsent(path.normalize(), new SourceFile(path, path.getFileName()));
            } else {
                throw new IOException("No such file or directory: " + path);
            }
        }
        return new ArrayList<>(found.values());
    }

    /**
     * Reads the files as UTF-8 batch items, named by relative path and labelled with the full path.
     *
     * @param files files to read
     * @return one item per file
     */
    static List<SourceItem> read(List<SourceFile> files) {
        List<SourceItem> items = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            try {
                String text = Files.readString(file.path(), StandardCharsets.UTF_8);
                items.add(new SourceItem(file.relativePath().toString(), file.path().toString(), text));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file.path(), e);
            }
        }
        return items;
    }
}
