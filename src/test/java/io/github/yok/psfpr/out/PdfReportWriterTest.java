package io.github.yok.psfpr.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.psfpr.core.run.ProgressState;
import io.github.yok.psfpr.core.run.StatusMessage;
import io.github.yok.psfpr.core.run.TerminationReason;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfReportWriterTest {

    @TempDir
    Path tmp;

    private final PdfReportWriter writer = new PdfReportWriter(
            Clock.fixed(Instant.parse("2026-10-18T09:30:05Z"), ZoneOffset.UTC));

    @Test
    void writesSingleA4PageWithResults() throws IOException {
        Path file = tmp.resolve("bead" + writer.fileSuffix());

        writer.write(ReportFixtures.context(ReportFixtures.fullStore()), file);

        try (PDDocument doc = PDDocument.load(file.toFile())) {
            assertEquals(1, doc.getNumberOfPages());
            PDRectangle box = doc.getPage(0).getMediaBox();
            assertEquals(PDRectangle.A4.getWidth(), box.getWidth(), 0.01);
            assertEquals(PDRectangle.A4.getHeight(), box.getHeight(), 0.01);

            String text = new PDFTextStripper().getText(doc);
            assertTrue(text.contains("Phase retrieval analysis"));
            assertTrue(text.contains("bead.ome.tif"));
            assertTrue(text.contains("Emission wavelength"));
            assertTrue(text.contains("520"));
            assertTrue(text.contains("Maximum iterations reached after 5 iterations."));
            assertTrue(text.contains("Primary Spherical"));
            assertTrue(text.contains("-0.62"));
            assertTrue(text.contains("0.30"));
            assertTrue(text.contains("Report generated on: 18.10.2026 - 09:30:05"));
        }
    }

    @Test
    void missingImagesAreSkipped() throws IOException {
        Path file = tmp.resolve("bead" + writer.fileSuffix());

        writer.write(ReportFixtures.context(new ImageArtifactStore()), file);

        try (PDDocument doc = PDDocument.load(file.toFile())) {
            assertEquals(1, doc.getNumberOfPages());
            assertTrue(new PDFTextStripper().getText(doc).contains("Zernike Polynomial"));
        }
    }

    @Test
    void singleLineStatusIsSuffixedWithIterationCount() {
        ProgressState s = ProgressState.running(37, 100, 1e-9, 1e-3)
                .terminate(TerminationReason.PUPIL_CONVERGED);

        assertEquals(Collections.singletonList("Pupil function converged after 37 iterations."),
                PdfReportWriter.statusLines(s, 100));
    }

    @Test
    void twoLineStatusAtMaxIterationsIsKept() {
        ProgressState s = new ProgressState(100, 0, 0, StatusMessage.of("Line one", "Line two"),
                null, false);

        assertEquals(Arrays.asList("Line one", "Line two"), PdfReportWriter.statusLines(s, 100));
    }

    @Test
    void twoLineStatusBeforeMaxIterationsShowsProgress() {
        ProgressState s = ProgressState.running(12, 100, 1e-3, 1e-3);

        assertEquals(Arrays.asList("During iteration 12 / 100 ", "Phase retrieval running..."),
                PdfReportWriter.statusLines(s, 100));
    }

    @Test
    void twoLineStatusBeyondMaxIterationsShowsNothing() {
        ProgressState s = ProgressState.running(120, 100, 1e-3, 1e-3);

        assertTrue(PdfReportWriter.statusLines(s, 100).isEmpty());
    }

    @Test
    void valuesAreRightAligned() throws IOException {
        float positive = PdfReportWriter.valueX(PDType1Font.HELVETICA, "0.30");
        float negative = PdfReportWriter.valueX(PDType1Font.HELVETICA, "-0.30");

        float width = PDType1Font.HELVETICA.getStringWidth("0.30") / 1000f * 10f;
        assertEquals(PdfReportWriter.VALUE_RIGHT_EDGE, positive + width, 1e-3);
        assertTrue(negative < positive);
    }
}
