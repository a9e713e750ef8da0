package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * パラメータと Zernike 分解結果を xlsx に出力するクラスです。
 *
 * <p>
 * シート名は {@code Zernike decomposition} で、セル位置は固定です（行・列は 0 始まり）。
 * </p>
 *
 * <ul>
 * <li>(0,0): PSF ファイルのパス（太字）</li>
 * <li>(2,0): {@code PSF Parameters}、(3..7, 0..1): PSF パラメータ名と値</li>
 * <li>(2,2): {@code Phase Retrieval Parameters}、(3..5, 2..3): 位相回復パラメータ名と値</li>
 * <li>(6,2): 停止した反復、(7,2): 状態メッセージ（太字）</li>
 * <li>(9,0): {@code Zernike Decomposition Results}、(10,0..2): 見出し、(11.., 0..2): 各多項式</li>
 * </ul>
 */
@Slf4j
public final class XlsxReportWriter implements ReportWriter {

    /**
     * シート名です。
     */
    public static final String SHEET_NAME = "Zernike decomposition";

    /**
     * xlsx に載せる位相回復パラメータです（許容位相ずれは表示設定のため含めません）。
     */
    private static final Set<FitParameterKey> FIT_KEYS = EnumSet.of(
            FitParameterKey.MAX_ITERATIONS, FitParameterKey.PUPIL_TOLERANCE,
            FitParameterKey.MSE_TOLERANCE);

    @Override
    public String fileSuffix() {
        return "_zd_results.xlsx";
    }

    @Override
    public void write(ReportContext context, Path file) {
        if (context == null) {
            throw new IllegalArgumentException("context は null 不可です");
        }
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }

        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(SHEET_NAME);
            CellStyle bold = boldStyle(wb);
            CellStyle shortNumber = wb.createCellStyle();
            shortNumber.setDataFormat(wb.createDataFormat().getFormat("0.00"));

            FitParameters p = context.getParameters();

            // 1) ファイル名とパラメータ
            setString(sheet, 0, 0, context.getSourcePath(), bold);
            setString(sheet, 2, 0, "PSF Parameters", bold);
            int row = 3;
            for (FitParameterKey key : FitParameterKey.values()) {
                if (key.getGroup() == FitParameterKey.Group.ACQUISITION) {
                    setString(sheet, row, 0, key.displayNameWithUnit(), null);
                    setNumber(sheet, row, 1, p.value(key), null);
                    row++;
                }
            }
            setString(sheet, 2, 2, "Phase Retrieval Parameters", bold);
            row = 3;
            for (FitParameterKey key : FIT_KEYS) {
                setString(sheet, row, 2, key.displayNameWithUnit(), null);
                setNumber(sheet, row, 3, p.value(key), null);
                row++;
            }

            // 2) 停止位置と状態
            setString(sheet, 6, 2, String.format(Locale.ROOT,
                    "Phase retrieval stopped after iteration %d out of %d.",
                    context.getProgress().getIteration(), p.maxIterations()), null);
            setString(sheet, 7, 2, context.getProgress().getStatus().joined().replace("\n", " "),
                    bold);

            // 3) Zernike 分解結果
            setString(sheet, 9, 0, "Zernike Decomposition Results", bold);
            setString(sheet, 10, 0, "Noll Order", bold);
            setString(sheet, 10, 1, "Noll Name", bold);
            setString(sheet, 10, 2, "Value", bold);
            List<CatalogRow> catalog = context.getCatalog();
            for (int i = 0; i < catalog.size(); i++) {
                CatalogRow c = catalog.get(i);
                setNumber(sheet, 11 + i, 0, c.getOrder(), null);
                setString(sheet, 11 + i, 1, c.getName(), null);
                setNumber(sheet, 11 + i, 2, c.getValue(), shortNumber);
            }

            try (OutputStream out = Files.newOutputStream(file)) {
                wb.write(out);
            }
        } catch (IOException e) {
            throw new ReportWriteException(file, "xlsx の出力に失敗しました", e);
        }
        log.info("xlsx を出力しました: {}", file);
    }

    private static CellStyle boldStyle(Workbook wb) {
        Font font = wb.createFont();
        font.setBold(true);
        CellStyle style = wb.createCellStyle();
        style.setFont(font);
        return style;
    }

    private static Cell cell(Sheet sheet, int row, int col) {
        Row r = sheet.getRow(row);
        if (r == null) {
            r = sheet.createRow(row);
        }
        return r.createCell(col);
    }

    private static void setString(Sheet sheet, int row, int col, String value, CellStyle style) {
        Cell c = cell(sheet, row, col);
        c.setCellValue(value);
        if (style != null) {
            c.setCellStyle(style);
        }
    }

    private static void setNumber(Sheet sheet, int row, int col, double value, CellStyle style) {
        Cell c = cell(sheet, row, col);
        c.setCellValue(value);
        if (style != null) {
            c.setCellStyle(style);
        }
    }
}
