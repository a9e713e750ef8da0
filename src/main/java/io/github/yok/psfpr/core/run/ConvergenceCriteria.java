package io.github.yok.psfpr.core.run;

import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import lombok.Value;

/**
 * 打ち切り判定の閾値です。
 */
@Value
public class ConvergenceCriteria {

    int maxIterations;

    double pupilTolerance;

    double mseTolerance;

    /**
     * パラメータから閾値を取り出します。
     *
     * @param parameters 検証済みのパラメータです
     * @return 閾値です
     */
    public static ConvergenceCriteria from(FitParameters parameters) {
        return new ConvergenceCriteria(parameters.maxIterations(),
                parameters.value(FitParameterKey.PUPIL_TOLERANCE),
                parameters.value(FitParameterKey.MSE_TOLERANCE));
    }
}
