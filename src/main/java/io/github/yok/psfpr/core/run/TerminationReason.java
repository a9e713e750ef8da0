package io.github.yok.psfpr.core.run;

import lombok.Getter;

/**
 * 位相回復が終了した理由です。
 */
@Getter
public enum TerminationReason {

    CANCELLED("Phase retrieval cancelled by user."),

    PUPIL_CONVERGED("Pupil function converged."),

    MSE_CONVERGED("Mean-square error converged."),

    MAX_ITERATIONS("Maximum iterations reached."),

    /**
     * ソルバの例外による中断です（{@link ConvergencePolicy} は返しません）。
     */
    SOLVER_FAILURE("Phase retrieval aborted by a solver failure.");

    /**
     * 表示用メッセージです。
     */
    private final String message;

    TerminationReason(String message) {
        this.message = message;
    }
}
