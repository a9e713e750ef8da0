package io.github.yok.psfpr.out;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 登録されたレポートをまとめて出力するクラスです。
 *
 * <p>
 * 出力は 1 ファイルずつ独立に行い、失敗しても残りのファイルの出力を続けます。 位相回復の実行中は出力を拒否します。
 * </p>
 */
@Slf4j
public final class ReportEmitter {

    private final List<ReportWriter> writers;

    private final BooleanSupplier runActive;

    /**
     * 生成します。
     *
     * @param writers 出力するレポートです（null 不可）
     * @param runActive 位相回復が実行中かどうかを返す関数です（null 不可）
     */
    public ReportEmitter(List<ReportWriter> writers, BooleanSupplier runActive) {
        if (writers == null) {
            throw new IllegalArgumentException("writers は null 不可です");
        }
        if (runActive == null) {
            throw new IllegalArgumentException("runActive は null 不可です");
        }
        this.writers = List.copyOf(writers);
        this.runActive = runActive;
    }

    /**
     * レポートを出力します。
     *
     * @param context 入力です
     * @param outputDir 出力先ディレクトリです
     * @param baseName ファイル名の先頭（PSF ファイル名から拡張子を除いたもの）です
     * @return ファイルごとの結果です
     * @throws IllegalStateException 位相回復の実行中に呼ばれた場合に発生します
     */
    public List<ReportOutcome> emit(ReportContext context, Path outputDir, String baseName) {
        if (context == null) {
            throw new IllegalArgumentException("context は null 不可です");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir は null 不可です");
        }
        if (baseName == null || baseName.isEmpty()) {
            throw new IllegalArgumentException("baseName は必須です");
        }
        if (runActive.getAsBoolean()) {
            throw new IllegalStateException("位相回復の実行中はレポートを出力できません");
        }

        List<ReportOutcome> outcomes = new ArrayList<>(writers.size());
        boolean dirReady = prepare(outputDir);
        for (ReportWriter writer : writers) {
            Path file = outputDir.resolve(baseName + writer.fileSuffix());
            if (!dirReady) {
                outcomes.add(ReportOutcome.failed(file, "出力先ディレクトリを作成できません: " + outputDir));
                continue;
            }
            try {
                writer.write(context, file);
                outcomes.add(ReportOutcome.written(file));
            } catch (ReportWriteException e) {
                log.warn("レポートの出力に失敗しました: {}", e.getMessage(), e);
                outcomes.add(ReportOutcome.failed(file, e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("レポートの出力中に想定外の例外が発生しました: {}", file, e);
                outcomes.add(ReportOutcome.failed(file, e.getClass().getSimpleName() + ": "
                        + e.getMessage()));
            }
        }
        return outcomes;
    }

    /**
     * PSF ファイル名から拡張子を除いた名前を返します。
     *
     * @param psfFile PSF ファイルです
     * @return ファイル名の先頭部分です
     */
    public static String baseNameOf(Path psfFile) {
        String name = psfFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean prepare(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            return true;
        } catch (IOException e) {
            log.warn("出力先ディレクトリを作成できません: {}", outputDir, e);
            return false;
        }
    }
}
