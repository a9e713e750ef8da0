package io.github.yok.psfpr.core.run;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.psfpr.core.acquisition.PixelStack;
import io.github.yok.psfpr.core.parameter.FitParameters;
import io.github.yok.psfpr.core.solver.PhaseRetrievalSolver;
import io.github.yok.psfpr.core.solver.PhaseRetrievalState;
import io.github.yok.psfpr.core.solver.PupilSnapshot;
import io.github.yok.psfpr.core.solver.StepResult;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * 位相回復をバックグラウンドで実行し、進捗の公開とキャンセルを提供するクラスです。
 *
 * <p>
 * 実行は常に 1 件のみで、実行中の {@link #start} は {@link RunAlreadyActiveException} で拒否します。
 * 呼び出し側は {@link #poll(RunHandle)} を一定間隔（目安 250 ms）で呼び、進捗を読み取ります。
 * </p>
 *
 * <p>
 * 反復の流れは以下です。
 * </p>
 *
 * <ol>
 * <li>キャンセル要求があれば直ちに終了します。</li>
 * <li>ソルバを 1 ステップ実行します。</li>
 * <li>反復数を進め、進捗スナップショットを 1 回で差し替えます。</li>
 * <li>{@link ConvergencePolicy} で打ち切りを判定します。</li>
 * </ol>
 */
@Slf4j
public final class RunCoordinator implements AutoCloseable {

    /**
     * 停止時に実行中の反復の完了を待つ時間（秒）です。
     */
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final PhaseRetrievalSolver solver;

    private final ConvergencePolicy policy;

    private final ProgressRenderer renderer;

    /**
     * 途中結果を描画する反復間隔です。
     */
    private final int renderEveryIterations;

    /**
     * Zernike 分解の最大項数です。
     */
    private final int zernikeTerms;

    private final ExecutorService executor;

    private final AtomicLong sequence = new AtomicLong();

    private RunHandle active;

    /**
     * コーディネータを生成します。
     *
     * @param solver 位相回復ソルバです（null 不可）
     * @param policy 打ち切り判定です（null 不可）
     * @param renderer 途中結果の描画先です（null 不可）
     * @param renderEveryIterations 途中結果を描画する反復間隔（1 以上）です
     * @param zernikeTerms Zernike 分解の最大項数（1 以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public RunCoordinator(PhaseRetrievalSolver solver, ConvergencePolicy policy,
            ProgressRenderer renderer, int renderEveryIterations, int zernikeTerms) {
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy は null 不可です");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer は null 不可です");
        }
        if (renderEveryIterations <= 0) {
            throw new IllegalArgumentException(
                    "renderEveryIterations は 1 以上が必要です: " + renderEveryIterations);
        }
        if (zernikeTerms <= 0) {
            throw new IllegalArgumentException("zernikeTerms は 1 以上が必要です: " + zernikeTerms);
        }
        this.solver = solver;
        this.policy = policy;
        this.renderer = renderer;
        this.renderEveryIterations = renderEveryIterations;
        this.zernikeTerms = zernikeTerms;
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("phase-retrieval-%d").setDaemon(true).build());
    }

    /**
     * 位相回復を開始します。検証に成功した場合はバックグラウンド実行を始めて直ちに戻ります。
     *
     * @param parameters パラメータです（開始時点のスナップショットを使用します）
     * @param data 測定 PSF です
     * @return 実行ハンドルです
     * @throws io.github.yok.psfpr.core.parameter.ParameterValidationException パラメータまたは形状が不正な場合に発生します
     * @throws RunAlreadyActiveException 別の実行が進行中の場合に発生します
     */
    public synchronized RunHandle start(FitParameters parameters, PixelStack data) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("RunCoordinator は既に停止しています");
        }
        if (isActive()) {
            throw new RunAlreadyActiveException("位相回復は既に実行中です: " + active);
        }

        parameters.validate(data == null ? null : data.shape());

        FitParameters snapshot = parameters.snapshot();
        ConvergenceCriteria criteria = ConvergenceCriteria.from(snapshot);
        RunHandle handle = new RunHandle(sequence.incrementAndGet(), criteria.getMaxIterations());
        active = handle;

        log.info("位相回復を開始します。{}、最大反復={}、瞳関数許容値={}、MSE許容値={}", handle,
                criteria.getMaxIterations(), fmt(criteria.getPupilTolerance()),
                fmt(criteria.getMseTolerance()));

        Future<?> future = executor.submit(() -> runLoop(handle, snapshot, data, criteria));
        handle.attach(future);
        return handle;
    }

    /**
     * 実行状態を返します。ブロックしません。
     *
     * @param handle 実行ハンドルです
     * @return 実行状態です
     */
    public PollResult poll(RunHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle は null 不可です");
        }
        RunResult result = handle.result();
        if (result == null) {
            return new PollResult(PollResult.Kind.RUNNING, handle.progress(), null);
        }
        PollResult.Kind kind = result.getReason() == TerminationReason.CANCELLED
                ? PollResult.Kind.CANCELLED
                : PollResult.Kind.COMPLETED;
        return new PollResult(kind, result.getProgress(), result);
    }

    /**
     * キャンセルを要求します。要求は次の反復境界で反映されます。
     *
     * @param handle 実行ハンドルです
     */
    public void cancel(RunHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle は null 不可です");
        }
        if (handle.result() == null) {
            log.info("キャンセルを要求しました: {}", handle);
        }
        handle.requestCancel();
    }

    /**
     * 実行中かどうかを返します。
     *
     * @return 実行中なら true です
     */
    public synchronized boolean isActive() {
        return active != null && active.result() == null;
    }

    /**
     * 実行の終了を待ちます。バッチ実行など、待機してよい呼び出し側向けです。
     *
     * @param handle 実行ハンドルです
     * @param timeout 待機時間です
     * @param unit 単位です
     * @return 結果です
     * @throws TimeoutException 時間内に終了しなかった場合に発生します
     * @throws InterruptedException 待機中に割り込まれた場合に発生します
     */
    public RunResult await(RunHandle handle, long timeout, TimeUnit unit)
            throws TimeoutException, InterruptedException {
        Future<?> future = handle.future();
        if (future != null) {
            try {
                future.get(timeout, unit);
            } catch (ExecutionException e) {
                throw new IllegalStateException("位相回復スレッドが異常終了しました: " + handle, e.getCause());
            }
        }
        return handle.result();
    }

    /**
     * 実行中の処理にキャンセルを要求し、スレッドを停止します。
     */
    @Override
    public void close() {
        RunHandle current;
        synchronized (this) {
            current = active;
        }
        if (current != null && current.result() == null) {
            current.requestCancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("位相回復スレッドが {} 秒以内に終了しませんでした", SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runLoop(RunHandle handle, FitParameters parameters, PixelStack data,
            ConvergenceCriteria criteria) {
        long t0 = System.nanoTime();
        int max = criteria.getMaxIterations();
        ConvergenceHistory history = new ConvergenceHistory();
        handle.publish(ProgressState.reset(max));

        TerminationReason reason = TerminationReason.SOLVER_FAILURE;
        double[] coefficients = new double[0];
        PupilSnapshot pupil = null;
        try {
            PhaseRetrievalState state = null;
            try {
                state = solver.initialize(data, parameters);
                reason = iterate(handle, state, criteria, history);
            } catch (RuntimeException e) {
                log.warn("位相回復がソルバの例外で中断されました: {}（反復={}）", e.getMessage(),
                        handle.progress().getIteration(), e);
                reason = TerminationReason.SOLVER_FAILURE;
            }

            if (reason != TerminationReason.SOLVER_FAILURE) {
                try {
                    pupil = state.snapshotPupil();
                    render(pupil, history, max);
                    coefficients = solver.decompose(state, zernikeTerms);
                } catch (RuntimeException e) {
                    log.warn("Zernike 分解に失敗しました: {}", e.getMessage(), e);
                    reason = TerminationReason.SOLVER_FAILURE;
                    coefficients = new double[0];
                }
            }
        } catch (Error e) {
            // Error でも実行は必ず終了状態にします。
            log.error("位相回復が回復不能なエラーで中断されました: {}（反復={}）", e,
                    handle.progress().getIteration(), e);
            reason = TerminationReason.SOLVER_FAILURE;
            coefficients = new double[0];
            pupil = null;
        } finally {
            finish(handle, reason, coefficients, history, pupil, t0);
        }
    }

    private void finish(RunHandle handle, TerminationReason reason, double[] coefficients,
            ConvergenceHistory history, PupilSnapshot pupil, long t0) {
        ProgressState terminal = handle.progress().terminate(reason);
        handle.complete(new RunResult(terminal, coefficients, history.copy(), pupil));
        handle.publish(terminal);

        double sec = (System.nanoTime() - t0) / 1e9;
        if (reason == TerminationReason.PUPIL_CONVERGED
                || reason == TerminationReason.MSE_CONVERGED) {
            log.info("位相回復が終了しました: {}（反復={}, 経過={} s）", reason.getMessage(),
                    terminal.getIteration(), fmt(sec));
        } else {
            log.warn("位相回復が収束前に終了しました: {}（反復={}, 経過={} s）", reason.getMessage(),
                    terminal.getIteration(), fmt(sec));
        }
    }

    private TerminationReason iterate(RunHandle handle, PhaseRetrievalState state,
            ConvergenceCriteria criteria, ConvergenceHistory history) {
        int max = criteria.getMaxIterations();
        int iteration = 0;
        while (true) {
            // 1) キャンセル確認
            if (handle.isCancelRequested()) {
                return TerminationReason.CANCELLED;
            }

            // 2) 1 ステップ
            StepResult step = solver.step(state);

            // 3) 反復数の更新と公開
            iteration++;
            history.append(step.getPupilDiff(), step.getMseDiff());
            handle.publish(ProgressState.running(iteration, max, step.getPupilDiff(),
                    step.getMseDiff()));
            if (iteration % renderEveryIterations == 0) {
                log.info("反復 {} / {}: 瞳関数差分={}, MSE差分={}", iteration, max,
                        fmt(step.getPupilDiff()), fmt(step.getMseDiff()));
                render(state.snapshotPupil(), history, max);
            }

            // 4) 打ち切り判定
            Optional<TerminationReason> reason = policy.evaluate(step.getPupilDiff(),
                    step.getMseDiff(), iteration, criteria, handle.isCancelRequested());
            if (reason.isPresent()) {
                return reason.get();
            }
            if (step.isConverged()) {
                log.debug("ソルバが収束を報告しました（反復={}）", iteration);
            }
        }
    }

    private void render(PupilSnapshot pupil, ConvergenceHistory history, int max) {
        try {
            renderer.render(pupil, history, max);
        } catch (RuntimeException e) {
            log.warn("途中結果の描画に失敗しました: {}", e.getMessage(), e);
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5g", v);
    }
}
