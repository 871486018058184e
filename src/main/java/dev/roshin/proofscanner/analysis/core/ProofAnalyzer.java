package dev.roshin.proofscanner.analysis.core;

import dev.roshin.proofscanner.analysis.config.AnalysisConfig;
import dev.roshin.proofscanner.analysis.model.AnalysisMetadata;
import dev.roshin.proofscanner.analysis.model.AnalysisReport;
import dev.roshin.proofscanner.analysis.model.FileRecommendation;
import dev.roshin.proofscanner.analysis.model.FileTimings;
import dev.roshin.proofscanner.analysis.model.enums.NodeKind;
import dev.roshin.proofscanner.analysis.model.tree.ProofTree;
import dev.roshin.proofscanner.analysis.report.SparkFileFinder;
import dev.roshin.proofscanner.analysis.report.SparkReportLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for prover timing analysis of gnatprove output.
 * Collects the reports below a directory, aggregates the proof attempts and
 * suggests, per source file, which provers to try first.
 */
public class ProofAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ProofAnalyzer.class);

    private final SparkFileFinder fileFinder;
    private final SparkReportLoader reportLoader;

    public ProofAnalyzer() {
        this(new SparkFileFinder(), new SparkReportLoader());
    }

    public ProofAnalyzer(SparkFileFinder fileFinder, SparkReportLoader reportLoader) {
        this.fileFinder = fileFinder;
        this.reportLoader = reportLoader;
    }

    /**
     * Analyzes all prover reports found below the given directory.
     *
     * @param reportRoot Directory containing the reports (searched recursively)
     * @param config     Analysis configuration parameters
     * @return Complete analysis report with prover recommendations and metadata
     * @throws IllegalArgumentException if reportRoot is not an existing directory
     */
    public AnalysisReport getReport(Path reportRoot, AnalysisConfig config) {
        log.info("Starting analysis of reports under: {}", reportRoot);
        LocalDateTime startTime = LocalDateTime.now();
        long startMs = System.currentTimeMillis();

        validateRoot(reportRoot);

        List<Path> reports = fileFinder.find(reportRoot, config.reportExtension());
        log.info("Found {} report files", reports.size());

        List<String> warnings = new ArrayList<>();
        List<String> skippedFiles = new ArrayList<>();
        ProofTree tree = loadReports(reports, warnings, skippedFiles);

        List<FileRecommendation> recommendations = analyze(tree, config);

        AnalysisMetadata metadata = new AnalysisMetadata(
                reports.size(),
                tree.count(NodeKind.ENTITY),
                tree.count(NodeKind.PROOF_ITEM),
                tree.count(NodeKind.ATTEMPT),
                List.copyOf(warnings),
                Duration.ofMillis(System.currentTimeMillis() - startMs),
                !skippedFiles.isEmpty(),
                List.copyOf(skippedFiles)
        );

        log.info("Analysis completed: {}", metadata);

        return new AnalysisReport(reportRoot, startTime, recommendations, metadata);
    }

    /**
     * Aggregates and ranks an already built proof tree. Holds no state between calls.
     *
     * @param tree   Proof tree to analyze
     * @param config Analysis configuration parameters
     * @return recommendations sorted by source file name
     */
    public List<FileRecommendation> analyze(ProofTree tree, AnalysisConfig config) {
        Map<String, FileTimings> timings = new TimingAggregator().aggregate(tree);
        return new RankingEngine(config).rank(timings);
    }

    private void validateRoot(Path reportRoot) {
        if (!Files.exists(reportRoot)) {
            throw new IllegalArgumentException("Report path does not exist: " + reportRoot);
        }

        if (!Files.isDirectory(reportRoot)) {
            throw new IllegalArgumentException("Report path is not a directory: " + reportRoot);
        }

        log.debug("Report root validation passed: {}", reportRoot);
    }

    /**
     * Loads every report into one tree. A report that can't be loaded is
     * recorded as skipped and contributes nothing.
     */
    private ProofTree loadReports(List<Path> reports, List<String> warnings, List<String> skippedFiles) {
        ProofTree.Builder builder = ProofTree.builder();

        for (Path report : reports) {
            try {
                int items = reportLoader.load(report, builder);
                log.debug("{}: {} proof items", report.getFileName(), items);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable report {}: {}", report, e.getMessage());
                warnings.add("Could not load " + report + ": " + e.getMessage());
                skippedFiles.add(report.toString());
            }
        }

        ProofTree tree = builder.build();
        log.info("Loaded {}", tree);
        return tree;
    }
}
