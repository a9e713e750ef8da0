package io.github.yok.psfpr.core.run;

import lombok.Value;

/**
 * 位相回復の進捗スナップショットです。
 *
 * <p>
 * 不変オブジェクトで、バックグラウンド処理が反復ごとに 1 度だけ差し替えて公開します。 読み手が観測する値は常に同じ反復のものです。
 * </p>
 */
@Value
public class ProgressState {

    /**
     * 完了した反復数です。
     */
    int iteration;

    double pupilDiff;

    double mseDiff;

    StatusMessage status;

    /**
     * 終了理由です（実行中は null）。
     */
    TerminationReason reason;

    boolean finished;

    /**
     * 実行前の状態を返します。
     *
     * @return 初期状態です
     */
    public static ProgressState notStarted() {
        return new ProgressState(0, 0.0, 0.0, StatusMessage.notStarted(), null, false);
    }

    /**
     * 実行開始時にリセットした状態を返します。
     *
     * @param maxIterations 最大反復回数です
     * @return リセット状態です
     */
    public static ProgressState reset(int maxIterations) {
        return new ProgressState(0, 0.0, 0.0, StatusMessage.inProgress(0, maxIterations), null,
                false);
    }

    /**
     * 反復後の実行中状態を返します。
     *
     * @param iteration 完了した反復数です
     * @param maxIterations 最大反復回数です
     * @param pupilDiff 瞳関数差分です
     * @param mseDiff MSE 差分です
     * @return 実行中状態です
     */
    public static ProgressState running(int iteration, int maxIterations, double pupilDiff,
            double mseDiff) {
        return new ProgressState(iteration, pupilDiff, mseDiff,
                StatusMessage.inProgress(iteration, maxIterations), null, false);
    }

    /**
     * この状態を終了状態にしたものを返します。反復数と差分は保持します。
     *
     * @param terminationReason 終了理由です
     * @return 終了状態です
     */
    public ProgressState terminate(TerminationReason terminationReason) {
        return new ProgressState(iteration, pupilDiff, mseDiff,
                StatusMessage.terminal(terminationReason), terminationReason, true);
    }
}
