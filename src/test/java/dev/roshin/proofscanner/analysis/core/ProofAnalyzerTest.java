package dev.roshin.proofscanner.analysis.core;

import dev.roshin.proofscanner.analysis.config.AnalysisConfig;
import dev.roshin.proofscanner.analysis.model.AnalysisReport;
import dev.roshin.proofscanner.analysis.model.FileRecommendation;
import dev.roshin.proofscanner.analysis.model.ProverRanking;
import dev.roshin.proofscanner.analysis.model.TimingStats;
import dev.roshin.proofscanner.analysis.model.enums.AttemptOutcome;
import dev.roshin.proofscanner.analysis.model.tree.ProofTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofAnalyzerTest {

    private final ProofAnalyzer analyzer = new ProofAnalyzer();

    @Test
    void analyzeRanksObservedProvers() {
        ProofTree.Builder builder = ProofTree.builder();
        int entity = builder.addEntity("Pkg.Child.Run");
        int body = builder.addProofItem(entity, "pkg", "pkg-child.adb", "VC_OVERFLOW_CHECK", 14);
        builder.addAttempt(body, "CVC4", AttemptOutcome.VALID, 2.0, 100);
        builder.addAttempt(body, "Z3", AttemptOutcome.TIMEOUT, 5.0, 0);
        int spec = builder.addProofItem(entity, "pkg", "pkg.ads", "VC_RANGE_CHECK", 7);
        builder.addAttempt(spec, "Trivial", AttemptOutcome.VALID, 0.0, 0);

        List<FileRecommendation> result = analyzer.analyze(builder.build(), AnalysisConfig.DEFAULT);

        assertEquals(1, result.size());
        FileRecommendation pkg = result.get(0);
        assertEquals("pkg.ads", pkg.sourceName());
        assertEquals(List.of(
                new ProverRanking("CVC4", new TimingStats(2.0, 0.0, 2.0, 1)),
                new ProverRanking("Z3", new TimingStats(0.0, 5.0, 0.0, 0))
        ), pkg.provers());
    }

    @Test
    void analyzeIsRepeatable() {
        ProofTree.Builder builder = ProofTree.builder();
        for (int e = 0; e < 5; e++) {
            int entity = builder.addEntity("Unit_" + e + ".Op");
            for (int i = 0; i < 4; i++) {
                int item = builder.addProofItem(entity, "unit_" + (e % 3), "unit_" + (e % 3) + (i % 2 == 0 ? ".ads" : ".adb"), "", i);
                builder.addAttempt(item, "CVC4", i % 3 == 0 ? AttemptOutcome.TIMEOUT : AttemptOutcome.VALID, 0.1 * i, 15_000L + i * 100);
                builder.addAttempt(item, "Z3", AttemptOutcome.VALID, 0.1 * e, 450_000L * i);
                builder.addAttempt(item, "altergo", AttemptOutcome.VALID, 0.1 * e, i);
            }
        }
        ProofTree tree = builder.build();

        List<FileRecommendation> first = analyzer.analyze(tree, AnalysisConfig.DEFAULT);
        List<FileRecommendation> second = analyzer.analyze(tree, AnalysisConfig.DEFAULT);

        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void getReportLoadsReportsRecursively() throws URISyntaxException {
        Path root = Path.of(getClass().getResource("/reports").toURI());

        AnalysisReport report = analyzer.getReport(root, AnalysisConfig.DEFAULT);

        assertNotNull(report.analysisTimestamp());
        assertEquals(List.of("pkg.ads", "util.adb"), report.recommendations().stream()
                .map(FileRecommendation::sourceName)
                .collect(Collectors.toList()));

        List<ProverRanking> util = report.recommendations().get(1).provers();
        assertEquals("Z3", util.get(0).prover());
        assertEquals(new TimingStats(0.5, 0.0, 0.5, 3), util.get(0).timings());
        assertEquals("altergo", util.get(1).prover());
        assertEquals(new TimingStats(0.25, 1.0, 0.25, 11), util.get(1).timings());

        assertEquals(3, report.metadata().totalReportsScanned());
        assertEquals(4, report.metadata().totalEntities());
        assertEquals(5, report.metadata().totalProofItems());
        assertEquals(7, report.metadata().totalAttempts());
        assertFalse(report.metadata().hadErrors());
        assertTrue(report.metadata().warnings().isEmpty());
    }

    @Test
    void unreadableReportIsSkippedAndRecorded(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("good.spark"), "{\"proof\": [{\"file\": \"good.adb\", \"entity\": {\"name\": \"Good\"},"
                + " \"check_tree\": [{\"proof_attempts\": {\"Z3\": {\"result\": \"Valid\", \"time\": 1.0, \"steps\": 1}}}]}]}");
        Files.writeString(dir.resolve("broken.spark"), "{ this is not json");
        Files.writeString(dir.resolve("negative.spark"), "{\"proof\": [{\"file\": \"neg.adb\", \"entity\": {\"name\": \"Neg\"},"
                + " \"check_tree\": [{\"proof_attempts\": {\"Z3\": {\"result\": \"Valid\", \"time\": -1.0, \"steps\": 1}}}]}]}");

        AnalysisReport report = analyzer.getReport(dir, AnalysisConfig.DEFAULT);

        assertEquals(1, report.recommendations().size());
        assertEquals("good.adb", report.recommendations().get(0).sourceName());
        assertTrue(report.metadata().hadErrors());
        assertEquals(2, report.metadata().skippedFiles().size());
        assertEquals(2, report.metadata().warnings().size());
        assertEquals(1, report.metadata().totalEntities());
    }

    @Test
    void reportRejectedLateContributesNothing(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("nan.spark"), "{\"proof\": ["
                + "{\"file\": \"a.adb\", \"entity\": {\"name\": \"A\"},"
                + " \"check_tree\": [{\"proof_attempts\": {\"Z3\": {\"result\": \"Valid\", \"time\": 1.0, \"steps\": 1}}}]},"
                + "{\"file\": \"b.adb\", \"entity\": {\"name\": \"B\"},"
                + " \"check_tree\": [{\"proof_attempts\": {\"Z3\": {\"result\": \"Valid\", \"time\": \"NaN\", \"steps\": 1}}}]}]}");

        AnalysisReport report = analyzer.getReport(dir, AnalysisConfig.DEFAULT);

        assertTrue(report.recommendations().isEmpty());
        assertEquals(0, report.metadata().totalEntities());
        assertEquals(1, report.metadata().skippedFiles().size());
    }

    @Test
    void emptyDirectoryYieldsEmptyReport(@TempDir Path dir) {
        AnalysisReport report = analyzer.getReport(dir, AnalysisConfig.DEFAULT);

        assertTrue(report.recommendations().isEmpty());
        assertEquals(0, report.metadata().totalReportsScanned());
    }

    @Test
    void invalidRootIsRejected(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("file.spark"), "{}");

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.getReport(dir.resolve("missing"), AnalysisConfig.DEFAULT));
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.getReport(file, AnalysisConfig.DEFAULT));
    }
}
