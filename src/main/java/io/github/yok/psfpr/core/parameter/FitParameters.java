package io.github.yok.psfpr.core.parameter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/**
 * PSF の取得条件と位相回復の設定値をまとめて保持するクラスです。
 *
 * <p>
 * プロセス内で 1 度だけ生成し、ユーザ入力と PSF ファイルの読み込み結果で更新します。 位相回復の開始前に
 * {@link #validate(int[])} で必須項目と PSF データ形状を検証します。
 * </p>
 */
public final class FitParameters {

    /**
     * 最大反復回数の既定値です。
     */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /**
     * 瞳関数差分の許容値の既定値です。
     */
    public static final double DEFAULT_PUPIL_TOLERANCE = 1e-8;

    /**
     * 相対 MSE 差分の許容値の既定値です。
     */
    public static final double DEFAULT_MSE_TOLERANCE = 1e-6;

    /**
     * 許容位相ずれ（λ 単位）の既定値です。
     */
    public static final double DEFAULT_PHASE_TOLERANCE = 0.5;

    /**
     * パラメータ値です（列挙順を保持します）。
     */
    private final Map<FitParameterKey, FitParameter> parameters =
            new EnumMap<>(FitParameterKey.class);

    /**
     * x/y 方向の画素数です（PSF 読み込み前は null）。
     */
    @Getter
    @Setter
    private Integer xySize;

    /**
     * z 方向の枚数です（PSF 読み込み前は null）。
     */
    @Getter
    @Setter
    private Integer zSize;

    /**
     * 全パラメータ未設定のインスタンスを生成します。
     */
    public FitParameters() {
        for (FitParameterKey key : FitParameterKey.values()) {
            parameters.put(key, new FitParameter(key));
        }
    }

    /**
     * 位相回復パラメータに既定値を設定したインスタンスを生成します。
     *
     * @return 既定値入りのパラメータです
     */
    public static FitParameters withDefaults() {
        FitParameters p = new FitParameters();
        p.set(FitParameterKey.MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS);
        p.set(FitParameterKey.PUPIL_TOLERANCE, DEFAULT_PUPIL_TOLERANCE);
        p.set(FitParameterKey.MSE_TOLERANCE, DEFAULT_MSE_TOLERANCE);
        p.set(FitParameterKey.PHASE_TOLERANCE, DEFAULT_PHASE_TOLERANCE);
        return p;
    }

    /**
     * パラメータを返します。
     *
     * @param key 識別子です
     * @return パラメータです
     */
    public FitParameter get(FitParameterKey key) {
        return parameters.get(key);
    }

    /**
     * 値を設定します。
     *
     * @param key 識別子です
     * @param value 値です（null で未設定）
     * @return this です
     */
    public FitParameters set(FitParameterKey key, Number value) {
        parameters.get(key).setValue(value == null ? null : value.doubleValue());
        return this;
    }

    /**
     * 値を返します。
     *
     * @param key 識別子です
     * @return 値です（未設定の場合は 0）
     */
    public double value(FitParameterKey key) {
        Double v = parameters.get(key).getValue();
        return v == null ? 0.0 : v;
    }

    /**
     * 最大反復回数を返します。
     *
     * @return 最大反復回数です
     */
    public int maxIterations() {
        return (int) value(FitParameterKey.MAX_ITERATIONS);
    }

    /**
     * 指定グループのパラメータを列挙順で返します。
     *
     * @param group グループです
     * @return パラメータ一覧です
     */
    public List<FitParameter> byGroup(FitParameterKey.Group group) {
        List<FitParameter> list = new ArrayList<>();
        for (FitParameter p : parameters.values()) {
            if (p.getKey().getGroup() == group) {
                list.add(p);
            }
        }
        return list;
    }

    /**
     * z ステップと xy ボクセルサイズの比（z / xy）を返します。
     *
     * @return アスペクト比です（xy 未設定の場合は 1）
     */
    public double voxelAspect() {
        double xy = value(FitParameterKey.XY_RESOLUTION);
        if (xy <= 0.0) {
            return 1.0;
        }
        return value(FitParameterKey.Z_RESOLUTION) / xy;
    }

    /**
     * 位相回復を開始できる状態かを検証します。
     *
     * <p>
     * ソルバ必須のパラメータがすべて設定済みで正の値であること、最大反復回数が 1 以上の整数であること、
     * 開口数が屈折率未満であること、PSF データ形状が {@code (zSize, xySize, xySize)} に一致することを確認します。
     * 違反はすべて集めてから 1 つの例外として報告します。
     * </p>
     *
     * @param stackShape PSF データの形状 {@code (z, y, x)} です（未読み込みの場合は null）
     * @throws ParameterValidationException 違反がある場合に発生します
     */
    public void validate(int[] stackShape) {
        List<ParameterValidationException.Violation> violations = new ArrayList<>();

        for (FitParameter p : parameters.values()) {
            FitParameterKey key = p.getKey();
            if (!p.isPresent()) {
                if (key.isRequiredBySolver()) {
                    violations.add(violation(key, "未設定です"));
                }
                continue;
            }
            double v = p.getValue();
            if (!Double.isFinite(v) || v <= 0.0) {
                violations.add(violation(key, "0 より大きい有限値が必要です: " + v));
            }
        }

        FitParameter na = get(FitParameterKey.NUMERICAL_APERTURE);
        FitParameter ni = get(FitParameterKey.REFRACTIVE_INDEX);
        if (na.isPresent() && ni.isPresent() && na.getValue() > 0.0
                && na.getValue() >= ni.getValue()) {
            violations.add(violation(FitParameterKey.NUMERICAL_APERTURE,
                    "開口数は屈折率未満である必要があります: na=" + na.getValue() + ", ni="
                            + ni.getValue()));
        }

        if (xySize == null || zSize == null || xySize <= 0 || zSize <= 0) {
            violations.add(new ParameterValidationException.Violation("image_size",
                    "PSF の画像サイズが未設定です"));
        }

        if (stackShape == null) {
            violations.add(new ParameterValidationException.Violation("psf_data",
                    "PSF データが読み込まれていません"));
        } else if (xySize != null && zSize != null && (stackShape.length != 3
                || stackShape[0] != zSize || stackShape[1] != xySize
                || stackShape[2] != xySize)) {
            violations.add(new ParameterValidationException.Violation("psf_data",
                    "PSF data array is not shaped correctly: expected (" + zSize + ", " + xySize
                            + ", " + xySize + ")"));
        }

        if (!violations.isEmpty()) {
            throw new ParameterValidationException(violations);
        }
    }

    /**
     * 現時点の値を複製したスナップショットを返します。
     *
     * <p>
     * レポート出力は、このスナップショットのみを参照します。
     * </p>
     *
     * @return スナップショットです
     */
    public FitParameters snapshot() {
        FitParameters s = new FitParameters();
        for (Map.Entry<FitParameterKey, FitParameter> e : parameters.entrySet()) {
            s.parameters.put(e.getKey(), e.getValue().copy());
        }
        s.xySize = xySize;
        s.zSize = zSize;
        return s;
    }

    private static ParameterValidationException.Violation violation(FitParameterKey key,
            String message) {
        return new ParameterValidationException.Violation(key.getShortKey(), message);
    }
}
