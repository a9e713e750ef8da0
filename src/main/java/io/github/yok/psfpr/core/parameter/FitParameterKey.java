package io.github.yok.psfpr.core.parameter;

import lombok.Getter;

/**
 * PSF パラメータおよび位相回復パラメータの識別子です。
 *
 * <p>
 * 表示名・単位・ソルバ必須かどうか・整数値かどうかを保持し、GUI やレポートの表示はこの定義に従います。
 * </p>
 */
@Getter
public enum FitParameterKey {

    /**
     * 中心発光波長です。
     */
    EMISSION_WAVELENGTH("wl", "Emission wavelength", "nm", Group.ACQUISITION, true, true),

    /**
     * 対物レンズの開口数です。
     */
    NUMERICAL_APERTURE("na", "Numerical aperture", "", Group.ACQUISITION, true, false),

    /**
     * 液浸媒質の屈折率です。
     */
    REFRACTIVE_INDEX("ni", "Refractive index", "", Group.ACQUISITION, true, false),

    /**
     * x/y 方向のボクセルサイズです。
     */
    XY_RESOLUTION("res", "xy-Resolution", "nm", Group.ACQUISITION, true, true),

    /**
     * z 方向のボクセルサイズ（z ステップ）です。
     */
    Z_RESOLUTION("zres", "z-Resolution", "nm", Group.ACQUISITION, true, true),

    /**
     * 位相回復の最大反復回数です。
     */
    MAX_ITERATIONS("max_iters", "Maximum iterations", "", Group.FIT, true, true),

    /**
     * 瞳関数の反復間差分の下限（これを下回ると打ち切り）です。
     */
    PUPIL_TOLERANCE("pupil_tol", "Minimal pupil function difference", "", Group.FIT, true, false),

    /**
     * 相対 MSE 差分の下限（これを下回ると打ち切り）です。
     */
    MSE_TOLERANCE("mse_tol", "Minimal relative MSE difference", "", Group.FIT, true, false),

    /**
     * Zernike 係数の許容位相ずれです（表示のみに影響し、ソルバには渡しません）。
     */
    PHASE_TOLERANCE("phase_tol", "Tolerable phase deviation", "λ", Group.FIT, false, false);

    /**
     * パラメータの分類です。
     */
    public enum Group {
        /**
         * PSF 取得条件（ファイルから読むか、ユーザが入力する値）です。
         */
        ACQUISITION,

        /**
         * 位相回復アルゴリズムの設定値です。
         */
        FIT
    }

    /**
     * ソルバ引数名（短縮キー）です。
     */
    private final String shortKey;

    /**
     * 表示名です。
     */
    private final String displayName;

    /**
     * 単位です（無次元の場合は空文字）。
     */
    private final String unit;

    /**
     * 分類です。
     */
    private final Group group;

    /**
     * 実行開始時に必須かどうかです。
     */
    private final boolean requiredBySolver;

    /**
     * 整数値として扱うかどうかです。
     */
    private final boolean integral;

    FitParameterKey(String shortKey, String displayName, String unit, Group group,
            boolean requiredBySolver, boolean integral) {
        this.shortKey = shortKey;
        this.displayName = displayName;
        this.unit = unit;
        this.group = group;
        this.requiredBySolver = requiredBySolver;
        this.integral = integral;
    }

    /**
     * 単位付きの表示名を返します（例: {@code Emission wavelength in nm}）。
     *
     * @return 単位付きの表示名です（単位が無い場合は表示名のみ）
     */
    public String displayNameWithUnit() {
        return unit.isEmpty() ? displayName : displayName + " in " + unit;
    }
}
