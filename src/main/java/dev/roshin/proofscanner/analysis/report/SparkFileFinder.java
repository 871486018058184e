package dev.roshin.proofscanner.analysis.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates prover report files below a directory.
 */
public class SparkFileFinder {
    private static final Logger log = LoggerFactory.getLogger(SparkFileFinder.class);

    /**
     * Recursively collects regular files whose name ends with the given extension.
     *
     * @param root      Directory to search
     * @param extension File name suffix, e.g. ".spark"
     * @return matching paths, sorted
     * @throws IllegalArgumentException if root is not an existing directory
     */
    public List<Path> find(Path root, String extension) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Report directory does not exist: " + root);
        }

        try (Stream<Path> files = Files.walk(root)) {
            List<Path> reports = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("Found {} '{}' files under {}", reports.size(), extension, root);
            return reports;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list report files under " + root, e);
        }
    }
}
