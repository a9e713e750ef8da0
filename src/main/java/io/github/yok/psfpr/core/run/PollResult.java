package io.github.yok.psfpr.core.run;

import lombok.Value;

/**
 * {@link RunCoordinator#poll(RunHandle)} の結果です。
 */
@Value
public class PollResult {

    /**
     * 実行の状態です。
     */
    public enum Kind {
        RUNNING, COMPLETED, CANCELLED
    }

    Kind kind;

    /**
     * 最新の進捗です。
     */
    ProgressState progress;

    /**
     * 結果です（実行中は null）。
     */
    RunResult result;

    public boolean isDone() {
        return kind != Kind.RUNNING;
    }
}
