package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.parameter.FitParameter;
import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import io.github.yok.psfpr.core.run.ProgressState;
import io.github.yok.psfpr.core.run.StatusMessage;
import io.github.yok.psfpr.core.zernike.ToleranceFlag;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * 解析結果を A4 1 ページの PDF に出力するクラスです。
 *
 * <p>
 * 座標は PDF のポイント単位（左下原点）で、すべて固定位置に配置します。 Zernike 係数の値は右端を
 * {@code 520 + 22.79} に揃え、フォントの実際の文字幅で位置を計算します（負号の幅も考慮されます）。
 * </p>
 */
@Slf4j
public final class PdfReportWriter implements ReportWriter {

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;
    private static final PDFont SYMBOL = PDType1Font.SYMBOL;

    /**
     * 係数の右端位置です。
     */
    static final float VALUE_RIGHT_EDGE = 520f + 22.79f;

    private static final float[] ACQUISITION_ROWS = {710, 693, 676, 659, 642};
    private static final float[] FIT_ROWS = {617, 600, 583, 566};

    private static final float[] GREEN = {0.22f, 0.67f, 0.15f};
    private static final float[] RED = {0.9f, 0.07f, 0.07f};
    private static final float[] BLACK = {0f, 0f, 0f};

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("dd.MM.yyyy - HH:mm:ss ", Locale.ROOT);

    private final Clock clock;

    /**
     * システム時計で生成します。
     */
    public PdfReportWriter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * 生成日時に使う時計を指定して生成します。
     *
     * @param clock 時計です（null 不可）
     */
    public PdfReportWriter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock は null 不可です");
        }
        this.clock = clock;
    }

    @Override
    public String fileSuffix() {
        return "_report.pdf";
    }

    @Override
    public void write(ReportContext context, Path file) {
        if (context == null) {
            throw new IllegalArgumentException("context は null 不可です");
        }
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }

        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            FitParameters p = context.getParameters();

            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                // 1) 見出しとファイル名
                text(cs, BOLD, 16, 100, 790, "Phase retrieval analysis");
                text(cs, BOLD, 12, 100, 760, "PSF file: ");
                text(cs, REGULAR, 10, 155, 760, fileName(context.getSourcePath()));
                text(cs, BOLD, 12, 100, 730, "PSF previews");
                text(cs, BOLD, 12, 370, 730, "PSF & Fit parameters");

                // 2) パラメータ一覧
                int i = 0;
                int j = 0;
                for (FitParameterKey key : FitParameterKey.values()) {
                    if (key.getGroup() == FitParameterKey.Group.ACQUISITION) {
                        legendEntry(cs, ACQUISITION_ROWS[i++], p.get(key));
                    } else {
                        legendEntry(cs, FIT_ROWS[j++], p.get(key));
                    }
                }

                // 3) PSF プレビュー
                text(cs, REGULAR, 10, 100, 710, "PSF x/y");
                text(cs, REGULAR, 10, 230, 710, "PSF x/z");
                image(doc, cs, context, ArtifactName.PSF_XY, 100, 585, 120, 120);
                image(doc, cs, context, ArtifactName.PSF_XZ, 230, 585, 120, 120);

                // 4) 位相回復結果と終了状態
                text(cs, BOLD, 12, 100, 550, "Phase retrieval results");
                image(doc, cs, context, ArtifactName.FIT_RESULT, 100, 390, 360, 150);
                image(doc, cs, context, ArtifactName.FIT_ERROR, 100, 325, 288, 72);
                List<String> status = statusLines(context.getProgress(), p.maxIterations());
                float y = status.size() == 2 ? 355 : 340;
                for (String line : status) {
                    text(cs, REGULAR, 8, 395, y, line);
                    y -= 15;
                }

                // 5) Zernike 分解結果
                text(cs, BOLD, 12, 100, 310, "Zernike decomposition results");
                image(doc, cs, context, ArtifactName.DECOMPOSITION, 100, 60, 240, 240);
                text(cs, BOLD, 10, 350, 285, "Zernike Polynomial");
                text(cs, BOLD, 10, 520, 285, "Value / λ");
                float rowY = 265;
                for (CatalogRow row : context.getCatalog()) {
                    PDFont font = row.isSalient() ? BOLD : REGULAR;
                    color(cs, BLACK);
                    text(cs, font, 10, 350, rowY, row.getName());
                    color(cs, colorOf(row.getFlag()));
                    String value = String.format(Locale.ROOT, "%.2f", row.getValue());
                    text(cs, font, 10, valueX(font, value), rowY, value);
                    rowY -= 17;
                }

                // 6) 生成日時
                color(cs, BLACK);
                text(cs, REGULAR, 10, 100, 10, "Report generated on: "
                        + LocalDateTime.now(clock).format(TIMESTAMP));
            }
            doc.save(file.toFile());
        } catch (IOException e) {
            throw new ReportWriteException(file, "PDF の出力に失敗しました", e);
        }
        log.info("PDF を出力しました: {}", file);
    }

    /**
     * 終了状態の表示行を返します。
     *
     * <ul>
     * <li>1 行の場合: 末尾 1 文字を除いて {@code " after N iterations."} を付けた 1 行</li>
     * <li>2 行で反復数が最大反復回数と等しい場合: 2 行をそのまま</li>
     * <li>2 行で反復数が最大反復回数未満の場合: {@code "During iteration N / max "} と 2 行目</li>
     * </ul>
     *
     * @param progress 進捗です
     * @param maxIterations 最大反復回数です
     * @return 上から順の表示行です（該当しない場合は空）
     */
    static List<String> statusLines(ProgressState progress, int maxIterations) {
        StatusMessage status = progress.getStatus();
        List<String> lines = status.getLines();
        int n = progress.getIteration();
        if (lines.size() == 1) {
            String first = lines.get(0);
            String head = first.isEmpty() ? first : first.substring(0, first.length() - 1);
            return Collections.singletonList(
                    String.format(Locale.ROOT, "%s after %d iterations.", head, n));
        }
        if (lines.size() == 2 && n == maxIterations) {
            return new ArrayList<>(lines);
        }
        if (lines.size() == 2 && n < maxIterations) {
            List<String> out = new ArrayList<>(2);
            out.add(String.format(Locale.ROOT, "During iteration %d / %d ", n, maxIterations));
            out.add(lines.get(1));
            return out;
        }
        return Collections.emptyList();
    }

    /**
     * 右端を揃えた係数の x 位置を返します。
     *
     * @param font フォントです
     * @param value 表示文字列です
     * @return x 位置です
     * @throws IOException 文字幅の取得に失敗した場合に発生します
     */
    static float valueX(PDFont font, String value) throws IOException {
        return VALUE_RIGHT_EDGE - font.getStringWidth(value) / 1000f * 10f;
    }

    private static void legendEntry(PDPageContentStream cs, float y, FitParameter parameter)
            throws IOException {
        text(cs, REGULAR, 10, 370, y, parameter.getName());
        String value = parameter.displayValue();
        text(cs, REGULAR, 10, 545 - width(REGULAR, 10, value), y, value);
        text(cs, REGULAR, 10, 550, y, parameter.getUnit());
    }

    private static void image(PDDocument doc, PDPageContentStream cs, ReportContext context,
            ArtifactName name, float x, float y, float w, float h) throws IOException {
        Optional<byte[]> png = context.artifact(name);
        if (!png.isPresent()) {
            log.warn("{} の画像が無いため PDF への配置を省略します", name);
            return;
        }
        PDImageXObject img = PDImageXObject.createFromByteArray(doc, png.get(), name.name());
        cs.drawImage(img, x, y, w, h);
    }

    private static float[] colorOf(ToleranceFlag flag) {
        switch (flag) {
            case WITHIN:
                return GREEN;
            case OUTSIDE:
                return RED;
            default:
                return BLACK;
        }
    }

    private static void color(PDPageContentStream cs, float[] rgb) throws IOException {
        cs.setNonStrokingColor(rgb[0], rgb[1], rgb[2]);
    }

    /**
     * 文字列を描画します。λ は Symbol フォントで描画し、フォントで表せない文字は {@code ?} に置き換えます。
     */
    private static void text(PDPageContentStream cs, PDFont font, float size, float x, float y,
            String s) throws IOException {
        if (s == null || s.isEmpty()) {
            return;
        }
        float cursor = x;
        StringBuilder run = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == 'λ') {
                cursor = show(cs, font, size, cursor, y, run.toString());
                run.setLength(0);
                cursor = show(cs, SYMBOL, size, cursor, y, "λ");
            } else {
                run.append(canEncode(font, c) ? c : '?');
            }
        }
        show(cs, font, size, cursor, y, run.toString());
    }

    private static float show(PDPageContentStream cs, PDFont font, float size, float x, float y,
            String s) throws IOException {
        if (s.isEmpty()) {
            return x;
        }
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(x, y);
        cs.showText(s);
        cs.endText();
        return x + width(font, size, s);
    }

    private static float width(PDFont font, float size, String s) throws IOException {
        float w = 0f;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == 'λ') {
                w += SYMBOL.getStringWidth("λ") / 1000f * size;
            } else if (canEncode(font, c)) {
                w += font.getStringWidth(String.valueOf(c)) / 1000f * size;
            } else {
                w += font.getStringWidth("?") / 1000f * size;
            }
        }
        return w;
    }

    private static boolean canEncode(PDFont font, char c) {
        try {
            font.encode(String.valueOf(c));
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private static String fileName(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(slash + 1);
    }
}
