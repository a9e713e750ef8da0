package io.github.yok.psfpr.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportEmitterTest {

    @TempDir
    Path tmp;

    private static List<ReportWriter> writers() {
        return Arrays.asList(new XlsxReportWriter(), new PdfReportWriter(),
                new CsvCoefficientWriter(),
                new PngArtifactWriter(ArtifactName.FIT_RESULT, "_pr_results.png"),
                new PngArtifactWriter(ArtifactName.DECOMPOSITION, "_zd_results.png"));
    }

    @Test
    void writesAllReportsIntoNewDirectory() {
        ReportEmitter emitter = new ReportEmitter(writers(), () -> false);
        Path dir = tmp.resolve("out").resolve("nested");

        List<ReportOutcome> outcomes =
                emitter.emit(ReportFixtures.context(ReportFixtures.fullStore()), dir, "bead");

        assertEquals(5, outcomes.size());
        for (ReportOutcome o : outcomes) {
            assertTrue(o.isSuccess(), o.getFile() + ": " + o.getError());
            assertTrue(Files.isRegularFile(o.getFile()));
        }
        assertTrue(Files.exists(dir.resolve("bead_zd_results.xlsx")));
        assertTrue(Files.exists(dir.resolve("bead_report.pdf")));
        assertTrue(Files.exists(dir.resolve("bead_zd_results.csv")));
        assertTrue(Files.exists(dir.resolve("bead_pr_results.png")));
        assertTrue(Files.exists(dir.resolve("bead_zd_results.png")));
    }

    @Test
    void oneFailureDoesNotStopTheOthers() {
        ImageArtifactStore store = ReportFixtures.fullStore();
        ImageArtifactStore partial = new ImageArtifactStore();
        partial.replace(ArtifactName.FIT_RESULT, store.read(ArtifactName.FIT_RESULT).get());
        ReportEmitter emitter = new ReportEmitter(writers(), () -> false);

        List<ReportOutcome> outcomes =
                emitter.emit(ReportFixtures.context(partial), tmp, "bead");

        assertEquals(5, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(3).isSuccess());
        ReportOutcome failed = outcomes.get(4);
        assertFalse(failed.isSuccess());
        assertEquals(tmp.resolve("bead_zd_results.png"), failed.getFile());
        assertTrue(failed.getError().contains("DECOMPOSITION"));
    }

    @Test
    void unexpectedWriterExceptionIsReportedAndOthersContinue() {
        ReportWriter broken = new ReportWriter() {
            @Override
            public String fileSuffix() {
                return "_broken.pdf";
            }

            @Override
            public void write(ReportContext context, Path file) {
                throw new IllegalArgumentException("画像を復号できません");
            }
        };
        ReportEmitter emitter = new ReportEmitter(
                Arrays.asList(broken, new CsvCoefficientWriter()), () -> false);

        List<ReportOutcome> outcomes = emitter
                .emit(ReportFixtures.context(ReportFixtures.fullStore()), tmp, "bead");

        assertEquals(2, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).getError().contains("画像を復号できません"));
        assertTrue(outcomes.get(1).isSuccess());
        assertTrue(Files.isRegularFile(tmp.resolve("bead_zd_results.csv")));
    }

    @Test
    void corruptImageBufferDoesNotStopOtherReports() {
        ImageArtifactStore store = ReportFixtures.fullStore();
        store.replace(ArtifactName.FIT_RESULT, new byte[] {0, 1, 2, 3});
        ReportEmitter emitter = new ReportEmitter(writers(), () -> false);

        List<ReportOutcome> outcomes = emitter.emit(ReportFixtures.context(store), tmp, "bead");

        assertEquals(5, outcomes.size());
        assertFalse(outcomes.get(1).isSuccess());
        assertTrue(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(2).isSuccess());
        assertTrue(outcomes.get(4).isSuccess());
    }

    @Test
    void invalidDestinationIsReportedPerFile() throws IOException {
        Path blocker = tmp.resolve("blocker");
        Files.write(blocker, new byte[] {1});
        ReportEmitter emitter = new ReportEmitter(writers(), () -> false);

        List<ReportOutcome> outcomes = emitter.emit(
                ReportFixtures.context(ReportFixtures.fullStore()), blocker.resolve("out"), "bead");

        assertEquals(5, outcomes.size());
        for (ReportOutcome o : outcomes) {
            assertFalse(o.isSuccess());
        }
    }

    @Test
    void refusedWhileRunIsActive() {
        ReportEmitter emitter = new ReportEmitter(writers(), () -> true);

        assertThrows(IllegalStateException.class, () -> emitter
                .emit(ReportFixtures.context(ReportFixtures.fullStore()), tmp, "bead"));
        assertFalse(Files.exists(tmp.resolve("bead_report.pdf")));
    }

    @Test
    void baseNameDropsLastExtension() {
        assertEquals("bead.ome", ReportEmitter.baseNameOf(Paths.get("/data/bead.ome.tif")));
        assertEquals("bead", ReportEmitter.baseNameOf(Paths.get("bead")));
        assertEquals(".hidden", ReportEmitter.baseNameOf(Paths.get(".hidden")));
    }
}
