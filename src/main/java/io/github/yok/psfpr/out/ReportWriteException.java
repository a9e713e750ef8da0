package io.github.yok.psfpr.out;

import java.nio.file.Path;
import lombok.Getter;

/**
 * レポートの出力に失敗したことを表す例外です。
 */
@Getter
public class ReportWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 出力先です。
     */
    private final transient Path file;

    public ReportWriteException(Path file, String message, Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public ReportWriteException(Path file, String message) {
        super(message + ": " + file);
        this.file = file;
    }
}
