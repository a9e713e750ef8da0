package io.github.yok.psfpr.out;

/**
 * レポートに載せる画像の名前です。
 */
public enum ArtifactName {

    /**
     * PSF の xy 断面プレビューです。
     */
    PSF_XY,

    /**
     * PSF の xz 断面プレビューです。
     */
    PSF_XZ,

    /**
     * 瞳関数（振幅・位相）です。
     */
    FIT_RESULT,

    /**
     * 収束履歴（瞳関数差分・MSE 差分）です。
     */
    FIT_ERROR,

    /**
     * Zernike 分解の棒グラフです。
     */
    DECOMPOSITION
}
