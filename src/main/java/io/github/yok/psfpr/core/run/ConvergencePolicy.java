package io.github.yok.psfpr.core.run;

import java.util.Optional;

/**
 * 反復ごとに打ち切りの要否と理由を判定するクラスです。
 *
 * <p>
 * 判定は以下の順で行い、最初に成立したものを採用します。
 * </p>
 *
 * <ol>
 * <li>キャンセル要求あり</li>
 * <li>瞳関数差分が許容値未満</li>
 * <li>MSE 差分が許容値未満</li>
 * <li>反復数が最大反復回数以上</li>
 * </ol>
 */
public final class ConvergencePolicy {

    /**
     * 打ち切りを判定します。
     *
     * @param pupilDiff 瞳関数差分です
     * @param mseDiff MSE 差分です
     * @param iteration 完了した反復数です
     * @param criteria 閾値です
     * @param cancelled キャンセル要求の有無です
     * @return 打ち切る場合はその理由、継続する場合は空です
     */
    public Optional<TerminationReason> evaluate(double pupilDiff, double mseDiff, int iteration,
            ConvergenceCriteria criteria, boolean cancelled) {
        if (cancelled) {
            return Optional.of(TerminationReason.CANCELLED);
        }
        if (pupilDiff < criteria.getPupilTolerance()) {
            return Optional.of(TerminationReason.PUPIL_CONVERGED);
        }
        if (mseDiff < criteria.getMseTolerance()) {
            return Optional.of(TerminationReason.MSE_CONVERGED);
        }
        if (iteration >= criteria.getMaxIterations()) {
            return Optional.of(TerminationReason.MAX_ITERATIONS);
        }
        return Optional.empty();
    }
}
