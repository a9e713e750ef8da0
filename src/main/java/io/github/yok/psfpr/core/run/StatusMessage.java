package io.github.yok.psfpr.core.run;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import lombok.Value;

/**
 * 実行状態の表示メッセージです。
 *
 * <p>
 * 終了時は理由の 1 行、実行中は {@code "Iteration i / max"} と {@code "Phase retrieval running..."} の 2 行です。
 * </p>
 */
@Value
public class StatusMessage {

    private static final String NOT_STARTED = "Phase retrieval not started yet";
    private static final String RUNNING = "Phase retrieval running...";

    List<String> lines;

    private StatusMessage(List<String> lines) {
        this.lines = ImmutableList.copyOf(lines);
    }

    /**
     * 実行前のメッセージです。
     *
     * @return メッセージです
     */
    public static StatusMessage notStarted() {
        return new StatusMessage(ImmutableList.of(NOT_STARTED));
    }

    /**
     * 実行中のメッセージです。
     *
     * @param iteration 完了した反復数です
     * @param maxIterations 最大反復回数です
     * @return メッセージです
     */
    public static StatusMessage inProgress(int iteration, int maxIterations) {
        return new StatusMessage(ImmutableList.of(
                String.format(Locale.ROOT, "Iteration %d / %d", iteration, maxIterations),
                RUNNING));
    }

    /**
     * 終了時のメッセージです。
     *
     * @param reason 終了理由です
     * @return メッセージです
     */
    public static StatusMessage terminal(TerminationReason reason) {
        return new StatusMessage(ImmutableList.of(reason.getMessage()));
    }

    /**
     * 任意の行からメッセージを生成します（読み込んだレポートの再現やテスト用）。
     *
     * @param lines 1 行または 2 行です
     * @return メッセージです
     * @throws IllegalArgumentException 行数が 1〜2 でない場合に発生します
     */
    public static StatusMessage of(String... lines) {
        if (lines == null || lines.length < 1 || lines.length > 2) {
            throw new IllegalArgumentException("ステータスは 1 行または 2 行で指定してください");
        }
        return new StatusMessage(ImmutableList.copyOf(lines));
    }

    public boolean isSingleLine() {
        return lines.size() == 1;
    }

    /**
     * 改行で連結した文字列を返します。
     *
     * @return 連結した文字列です
     */
    public String joined() {
        return String.join("\n", lines);
    }
}
