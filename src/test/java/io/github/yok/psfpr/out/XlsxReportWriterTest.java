package io.github.yok.psfpr.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XlsxReportWriterTest {

    @TempDir
    Path tmp;

    private final XlsxReportWriter writer = new XlsxReportWriter();

    @Test
    void writesParametersStatusAndCatalogAtFixedCells() throws IOException {
        Path file = tmp.resolve("bead" + writer.fileSuffix());

        writer.write(ReportFixtures.context(ReportFixtures.fullStore()), file);

        try (InputStream in = Files.newInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet(XlsxReportWriter.SHEET_NAME);
            assertNotNull(sheet);

            assertEquals(ReportFixtures.SOURCE, text(sheet, 0, 0));
            assertTrue(wb.getFontAt(sheet.getRow(0).getCell(0).getCellStyle().getFontIndex())
                    .getBold());

            assertEquals("PSF Parameters", text(sheet, 2, 0));
            assertEquals("Emission wavelength in nm", text(sheet, 3, 0));
            assertEquals(520.0, number(sheet, 3, 1));
            assertEquals("Numerical aperture", text(sheet, 4, 0));
            assertEquals(1.4, number(sheet, 4, 1));
            assertEquals("z-Resolution in nm", text(sheet, 7, 0));
            assertEquals(250.0, number(sheet, 7, 1));

            assertEquals("Phase Retrieval Parameters", text(sheet, 2, 2));
            assertEquals("Maximum iterations", text(sheet, 3, 2));
            assertEquals(5.0, number(sheet, 3, 3));
            assertEquals(1e-8, number(sheet, 4, 3));
            assertEquals(1e-6, number(sheet, 5, 3));

            assertEquals("Phase retrieval stopped after iteration 5 out of 5.",
                    text(sheet, 6, 2));
            assertEquals("Maximum iterations reached.", text(sheet, 7, 2));

            assertEquals("Zernike Decomposition Results", text(sheet, 9, 0));
            assertEquals("Noll Order", text(sheet, 10, 0));
            assertEquals("Noll Name", text(sheet, 10, 1));
            assertEquals("Value", text(sheet, 10, 2));
            assertEquals(1.0, number(sheet, 11, 0));
            assertEquals("Piston", text(sheet, 11, 1));
            assertEquals(0.3, number(sheet, 15, 2), 1e-12);
            assertEquals("0.00",
                    sheet.getRow(15).getCell(2).getCellStyle().getDataFormatString());
            assertEquals(-0.62, number(sheet, 21, 2), 1e-12);
            assertEquals(15.0, number(sheet, 25, 0));
            assertEquals(null, sheet.getRow(26));
        }
    }

    @Test
    void unwritableDestinationRaisesReportWriteException() {
        Path file = tmp.resolve("missing-dir").resolve("bead.xlsx");

        ReportWriteException e = assertThrows(ReportWriteException.class,
                () -> writer.write(ReportFixtures.context(new ImageArtifactStore()), file));
        assertEquals(file, e.getFile());
    }

    private static String text(Sheet sheet, int row, int col) {
        return sheet.getRow(row).getCell(col).getStringCellValue();
    }

    private static double number(Sheet sheet, int row, int col) {
        return sheet.getRow(row).getCell(col).getNumericCellValue();
    }
}
