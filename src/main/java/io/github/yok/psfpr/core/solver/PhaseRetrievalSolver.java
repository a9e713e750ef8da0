package io.github.yok.psfpr.core.solver;

import io.github.yok.psfpr.core.acquisition.PixelStack;
import io.github.yok.psfpr.core.parameter.FitParameters;

/**
 * 位相回復ソルバの抽象です。
 *
 * <p>
 * 反復の制御（打ち切り判定・キャンセル）は呼び出し側が行い、ソルバは 1 ステップ分の計算のみを担当します。
 * </p>
 */
public interface PhaseRetrievalSolver {

    /**
     * 初期状態を生成します。
     *
     * @param stack 測定 PSF です
     * @param parameters 検証済みのパラメータです
     * @return ソルバ内部状態です
     * @throws SolverException 初期化に失敗した場合に発生します
     */
    PhaseRetrievalState initialize(PixelStack stack, FitParameters parameters);

    /**
     * 1 反復を実行し、状態を更新します。
     *
     * @param state ソルバ内部状態です
     * @return 反復結果です
     * @throws SolverException 計算に失敗した場合に発生します
     */
    StepResult step(PhaseRetrievalState state);

    /**
     * 現在の瞳関数の位相を Zernike 多項式（Noll 順）に分解します。
     *
     * @param state ソルバ内部状態です
     * @param maxTerms 最大項数です
     * @return 係数（λ 単位、Noll 次数 1 から順）です
     * @throws SolverException 分解に失敗した場合に発生します
     */
    double[] decompose(PhaseRetrievalState state, int maxTerms);
}
