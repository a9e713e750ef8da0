package io.github.yok.psfpr.core.run;

import io.github.yok.psfpr.core.solver.PupilSnapshot;

/**
 * 実行中の途中結果（瞳関数・収束履歴）を画像として公開するコンポーネントです。
 */
public interface ProgressRenderer {

    /**
     * 途中結果を描画します。
     *
     * @param pupil 瞳関数です
     * @param history 収束履歴です
     * @param maxIterations 最大反復回数です
     */
    void render(PupilSnapshot pupil, ConvergenceHistory history, int maxIterations);
}
