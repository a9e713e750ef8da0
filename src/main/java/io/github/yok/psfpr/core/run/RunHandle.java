package io.github.yok.psfpr.core.run;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 1 回の実行を識別するハンドルです。
 *
 * <p>
 * キャンセル要求と進捗スナップショットを保持し、バックグラウンド処理と呼び出し側はこれを介してのみやり取りします。
 * </p>
 */
public final class RunHandle {

    private final long id;
    private final int maxIterations;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicReference<ProgressState> progress;
    private volatile RunResult result;
    private volatile Future<?> future;

    RunHandle(long id, int maxIterations) {
        this.id = id;
        this.maxIterations = maxIterations;
        this.progress = new AtomicReference<>(ProgressState.reset(maxIterations));
    }

    public long getId() {
        return id;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * 最新の進捗スナップショットを返します。
     *
     * @return 進捗です
     */
    public ProgressState progress() {
        return progress.get();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void requestCancel() {
        cancelRequested.set(true);
    }

    void publish(ProgressState state) {
        progress.set(state);
    }

    RunResult result() {
        return result;
    }

    void complete(RunResult runResult) {
        this.result = runResult;
    }

    Future<?> future() {
        return future;
    }

    void attach(Future<?> f) {
        this.future = f;
    }

    @Override
    public String toString() {
        return "RunHandle#" + id;
    }
}
