package io.github.yok.psfpr.core.zernike;

/**
 * Zernike 係数を許容位相ずれと比較した結果です。
 */
public enum ToleranceFlag {

    /**
     * 未分類です（対応する係数がありません）。
     */
    UNCLASSIFIED,

    /**
     * 絶対値が許容値未満です。
     */
    WITHIN,

    /**
     * 絶対値が許容値以上です。
     */
    OUTSIDE
}
