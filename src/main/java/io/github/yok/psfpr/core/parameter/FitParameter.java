package io.github.yok.psfpr.core.parameter;

import java.math.BigDecimal;
import java.util.Locale;
import lombok.Getter;

/**
 * 1 つのパラメータ値（表示名・単位・設定済みかどうか）を保持するクラスです。
 *
 * <p>
 * 値が {@code null} の場合は未設定（absent）を表します。
 * </p>
 */
@Getter
public final class FitParameter {

    private static final double SCIENTIFIC_BELOW = 1e-3;

    /**
     * パラメータ識別子です。
     */
    private final FitParameterKey key;

    /**
     * 値です（未設定の場合は null）。
     */
    private Double value;

    /**
     * 未設定のパラメータを生成します。
     *
     * @param key パラメータ識別子です（null 不可）
     * @throws IllegalArgumentException key が null の場合に発生します
     */
    public FitParameter(FitParameterKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key は null 不可です");
        }
        this.key = key;
    }

    /**
     * 値を設定します。
     *
     * <p>
     * 整数パラメータ（波長・ボクセルサイズ・最大反復回数）は小数部を切り捨てて保持します。
     * </p>
     *
     * @param value 値です（null で未設定に戻します）
     */
    public void setValue(Double value) {
        if (value != null && key.isIntegral() && Double.isFinite(value)) {
            this.value = Math.floor(value);
        } else {
            this.value = value;
        }
    }

    /**
     * 値が設定済みかどうかを返します。
     *
     * @return 設定済みなら true です
     */
    public boolean isPresent() {
        return value != null;
    }

    /**
     * 表示名です。
     *
     * @return 表示名です
     */
    public String getName() {
        return key.getDisplayName();
    }

    /**
     * 単位です。
     *
     * @return 単位です（無次元は空文字）
     */
    public String getUnit() {
        return key.getUnit();
    }

    /**
     * レポート表示用の値文字列を返します。
     *
     * <p>
     * 整数パラメータは {@code 520}、実数パラメータは {@code 1.4} のように末尾の 0 を除いて整形します。
     * 絶対値が {@code 1e-3} 未満の実数は {@code 1.0e-08} のような指数表記になります。
     * 書式はロケールに依存しません。未設定の場合は {@code 0} 相当を返します。
     * </p>
     *
     * @return 表示用文字列です
     */
    public String displayValue() {
        double v = (value == null) ? 0.0 : value;
        if (key.isIntegral()) {
            return String.format(Locale.ROOT, "%d", (long) v);
        }
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return Double.toString(v);
        }
        if (v != 0.0 && Math.abs(v) < SCIENTIFIC_BELOW) {
            return String.format(Locale.ROOT, "%.1e", v);
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    /**
     * コピーを生成します。
     *
     * @return 同じ値を持つ新しいインスタンスです
     */
    FitParameter copy() {
        FitParameter c = new FitParameter(key);
        c.value = value;
        return c;
    }
}
