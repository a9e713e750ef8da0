package io.github.yok.psfpr.core.run;

import io.github.yok.psfpr.core.solver.PupilSnapshot;
import lombok.Value;

/**
 * 終了した実行の結果です。
 */
@Value
public class RunResult {

    /**
     * 終了時の進捗です（finished は必ず true）。
     */
    ProgressState progress;

    /**
     * ソルバが返した係数です（Noll 次数順。ソルバ失敗時は空）。
     */
    double[] coefficients;

    ConvergenceHistory history;

    /**
     * 終了時の瞳関数です（取得できなかった場合は null）。
     */
    PupilSnapshot pupil;

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public TerminationReason getReason() {
        return progress.getReason();
    }
}
