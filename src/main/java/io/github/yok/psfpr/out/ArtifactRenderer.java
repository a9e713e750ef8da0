package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.solver.PupilSnapshot;
import java.util.List;

/**
 * データ系列から PNG 画像を生成するコンポーネントです。
 */
public interface ArtifactRenderer {

    /**
     * PSF の断面を描画します。
     *
     * @param plane 断面 {@code [行][列]} です
     * @param aspect 縦方向の画素の縦横比（縦 / 横）です
     * @param title 見出しです
     * @return PNG です
     */
    byte[] renderSlice(double[][] plane, double aspect, String title);

    /**
     * 瞳関数の振幅と位相を並べて描画します。
     *
     * @param pupil 瞳関数です
     * @return PNG です
     */
    byte[] renderPupil(PupilSnapshot pupil);

    /**
     * 収束履歴を描画します。
     *
     * @param pupilDiffs 瞳関数差分です
     * @param mseDiffs MSE 差分です
     * @param maxIterations 最大反復回数です
     * @return PNG です
     */
    byte[] renderConvergence(double[] pupilDiffs, double[] mseDiffs, int maxIterations);

    /**
     * Zernike 係数を棒グラフで描画します。
     *
     * @param rows カタログの行です
     * @return PNG です
     */
    byte[] renderDecomposition(List<CatalogRow> rows);
}
