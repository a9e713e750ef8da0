package io.github.yok.psfpr.out;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * ソルバが返した全 Zernike 係数を CSV に出力するクラスです。
 *
 * <p>
 * 列は {@code noll_order, name, value, tolerance} です。カタログに無い次数は name と tolerance が空になります。
 * </p>
 */
@Slf4j
public final class CsvCoefficientWriter implements ReportWriter {

    @Override
    public String fileSuffix() {
        return "_zd_results.csv";
    }

    @Override
    public void write(ReportContext context, Path file) {
        if (context == null) {
            throw new IllegalArgumentException("context は null 不可です");
        }
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }

        double[] coefficients = context.getRawCoefficients();
        List<CatalogRow> catalog = context.getCatalog();

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setHeader("noll_order", "name", "value", "tolerance").build();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter p = format.print(w)) {
            for (int i = 0; i < coefficients.length; i++) {
                boolean inCatalog = i < catalog.size();
                p.printRecord(i + 1, inCatalog ? catalog.get(i).getName() : "",
                        String.format(Locale.ROOT, "%.6f", coefficients[i]),
                        inCatalog ? catalog.get(i).getFlag().name() : "");
            }
        } catch (IOException e) {
            throw new ReportWriteException(file, "CSV の出力に失敗しました", e);
        }
        log.info("CSV を出力しました: {}（{} 項）", file, coefficients.length);
    }
}
