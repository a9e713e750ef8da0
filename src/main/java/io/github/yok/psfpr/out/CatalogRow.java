package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.zernike.PolynomialCatalogEntry;
import io.github.yok.psfpr.core.zernike.ResultClassifier;
import io.github.yok.psfpr.core.zernike.ToleranceFlag;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * レポート用に複製したカタログの 1 行です。
 */
@Value
public class CatalogRow {

    int order;

    String name;

    double value;

    ToleranceFlag flag;

    /**
     * 強調表示するかどうかです。
     */
    boolean salient;

    /**
     * カタログを複製します。
     *
     * @param catalog 分類済みのカタログです
     * @return 行の一覧です
     */
    public static List<CatalogRow> copyOf(List<PolynomialCatalogEntry> catalog) {
        List<CatalogRow> rows = new ArrayList<>(catalog.size());
        for (PolynomialCatalogEntry e : catalog) {
            rows.add(new CatalogRow(e.getOrder(), e.getName(), e.getValue(), e.getFlag(),
                    ResultClassifier.isSalient(e.getOrder())));
        }
        return List.copyOf(rows);
    }
}
