package io.github.yok.psfpr.out;

import java.nio.file.Path;
import lombok.Value;

/**
 * 1 ファイル分のレポート出力結果です。
 */
@Value
public class ReportOutcome {

    Path file;

    boolean success;

    /**
     * 失敗理由です（成功時は null）。
     */
    String error;

    static ReportOutcome written(Path file) {
        return new ReportOutcome(file, true, null);
    }

    static ReportOutcome failed(Path file, String error) {
        return new ReportOutcome(file, false, error);
    }
}
