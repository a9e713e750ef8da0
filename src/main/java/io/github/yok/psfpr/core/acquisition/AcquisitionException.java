package io.github.yok.psfpr.core.acquisition;

import lombok.Getter;

/**
 * PSF ファイルの読み込みに失敗したことを表す例外です。
 */
@Getter
public class AcquisitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 失敗の種別です。
     */
    public enum Kind {
        /**
         * ファイルは読めたが、対応していない形式・メタデータです。
         */
        UNSUPPORTED_FORMAT,

        /**
         * パスが存在しない、または読み取れません。
         */
        INVALID_PATH
    }

    private final Kind kind;

    public AcquisitionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AcquisitionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
