package io.github.yok.psfpr.core.run;

/**
 * 実行中に別の実行を開始しようとしたことを表す例外です。
 */
public class RunAlreadyActiveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RunAlreadyActiveException(String message) {
        super(message);
    }
}
