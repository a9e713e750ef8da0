package io.github.yok.psfpr.core.zernike;

import lombok.Getter;

/**
 * Zernike 多項式カタログの 1 項目です。
 *
 * <p>
 * 次数（Noll）と名前は固定で、値と許容判定のみが {@link ResultClassifier} によって更新されます。
 * </p>
 */
@Getter
public final class PolynomialCatalogEntry {

    /**
     * Noll 次数（1 始まり）です。
     */
    private final int order;

    /**
     * 多項式名です。
     */
    private final String name;

    /**
     * 係数（λ 単位）です。
     */
    private double value;

    /**
     * 許容判定です。
     */
    private ToleranceFlag flag = ToleranceFlag.UNCLASSIFIED;

    PolynomialCatalogEntry(int order, String name) {
        this.order = order;
        this.name = name;
    }

    void classify(double value, double tolerance) {
        this.value = value;
        this.flag = Math.abs(value) < tolerance ? ToleranceFlag.WITHIN : ToleranceFlag.OUTSIDE;
    }

    @Override
    public String toString() {
        return order + ":" + name + "=" + value + "(" + flag + ")";
    }
}
