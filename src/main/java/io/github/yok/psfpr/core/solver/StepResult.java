package io.github.yok.psfpr.core.solver;

import lombok.Value;

/**
 * 1 反復の結果です。
 */
@Value
public class StepResult {

    /**
     * 前反復との瞳関数の相対差分です。
     */
    double pupilDiff;

    /**
     * 前反復との MSE の相対差分です。
     */
    double mseDiff;

    /**
     * ソルバ自身が収束と判断したかどうかです。
     */
    boolean converged;
}
