package io.github.yok.psfpr.out;

import java.nio.file.Path;

/**
 * レポートを 1 ファイル出力するインターフェースです。
 */
public interface ReportWriter {

    /**
     * 出力ファイル名の末尾（PSF ファイル名の拡張子を除いた部分に続く文字列）を返します。
     *
     * @return 例: {@code _report.pdf}
     */
    String fileSuffix();

    /**
     * レポートを出力します。入力は変更しません。
     *
     * @param context 入力です
     * @param file 出力先です
     * @throws ReportWriteException 出力に失敗した場合に発生します
     */
    void write(ReportContext context, Path file);
}
