package dev.roshin.proofscanner.analysis.render;

import dev.roshin.proofscanner.analysis.model.FileRecommendation;
import dev.roshin.proofscanner.analysis.model.ProverRanking;
import dev.roshin.proofscanner.analysis.model.TimingStats;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextReportRendererTest {

    private final TextReportRenderer renderer = new TextReportRenderer();

    @Test
    void rendersOneBlockPerFile() {
        List<FileRecommendation> files = List.of(
                new FileRecommendation("pkg.ads", List.of(
                        new ProverRanking("CVC4", new TimingStats(2.0, 0.0, 2.0, 1)),
                        new ProverRanking("Z3", new TimingStats(0.0, 5.0, 0.0, 0)))),
                new FileRecommendation("util.adb", List.of(
                        new ProverRanking("altergo", new TimingStats(0.25, 1.0, 0.25, 11)))));

        String nl = System.lineSeparator();
        String expected = "pkg.ads" + nl
                + "  CVC4         success=2.00s failed=0.00s max=2.00s steps=1" + nl
                + "  Z3           success=0.00s failed=5.00s max=0.00s steps=0" + nl
                + "util.adb" + nl
                + "  altergo      success=0.25s failed=1.00s max=0.25s steps=11" + nl;

        assertEquals(expected, renderer.render(files));
    }

    @Test
    void emptyRecommendationsRenderPlaceholder() {
        assertEquals(TextReportRenderer.EMPTY_MESSAGE + System.lineSeparator(), renderer.render(List.of()));
    }
}
