package io.github.yok.psfpr.core.zernike;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * ソルバが返す Zernike 係数を固定順のカタログへ割り当て、許容位相ずれで判定するクラスです。
 *
 * <p>
 * 係数とカタログは先頭から位置で対応付け、短い方の長さで打ち切ります。 対応する係数が無いカタログ項目は値 0、
 * {@link ToleranceFlag#UNCLASSIFIED} のままです。
 * </p>
 */
@Slf4j
public final class ResultClassifier {

    /**
     * Noll 次数順の多項式名です（インデックス 0 が次数 1）。
     */
    private static final List<String> NOLL_NAMES = ImmutableList.of("Piston", "Tip (X-Tilt)",
            "Tilt (Y-Tilt)", "Defocus", "Oblique Astigmatism", "Vertical Astigmatism",
            "Vertical Coma", "Horizontal Coma", "Vertical Trefoil", "Oblique Trefoil",
            "Primary Spherical", "Vertical Secondary Astigmatism",
            "Oblique Secondary Astigmatism", "Vertical Quadrafoil", "Oblique Quadrafoil");

    /**
     * レポートで強調表示する次数です。
     */
    private static final ImmutableSet<Integer> SALIENT_ORDERS = ImmutableSet.of(5, 6, 7, 8, 11);

    /**
     * 全項目が値 0・未分類の新しいカタログを返します。
     *
     * @return Noll 次数の昇順に並んだカタログです
     */
    public List<PolynomialCatalogEntry> initializeCatalog() {
        List<PolynomialCatalogEntry> catalog = new ArrayList<>(NOLL_NAMES.size());
        for (int i = 0; i < NOLL_NAMES.size(); i++) {
            catalog.add(new PolynomialCatalogEntry(i + 1, NOLL_NAMES.get(i)));
        }
        return catalog;
    }

    /**
     * 係数をカタログに割り当てて判定します。
     *
     * @param rawCoefficients ソルバの係数（Noll 次数順）です（null 不可）
     * @param catalog 割り当て先のカタログです（null 不可）
     * @param tolerance 許容位相ずれです
     * @return 引数と同じカタログです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public List<PolynomialCatalogEntry> classify(double[] rawCoefficients,
            List<PolynomialCatalogEntry> catalog, double tolerance) {
        if (rawCoefficients == null) {
            throw new IllegalArgumentException("rawCoefficients は null 不可です");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog は null 不可です");
        }
        int n = Math.min(rawCoefficients.length, catalog.size());
        for (int i = 0; i < n; i++) {
            catalog.get(i).classify(rawCoefficients[i], tolerance);
        }
        if (rawCoefficients.length != catalog.size()) {
            log.debug("係数 {} 件のうち先頭 {} 件をカタログ（{} 項目）に割り当てました", rawCoefficients.length,
                    n, catalog.size());
        }
        return catalog;
    }

    /**
     * 強調表示する次数かどうかを返します。
     *
     * @param order Noll 次数です
     * @return 強調表示するなら true です
     */
    public static boolean isSalient(int order) {
        return SALIENT_ORDERS.contains(order);
    }
}
