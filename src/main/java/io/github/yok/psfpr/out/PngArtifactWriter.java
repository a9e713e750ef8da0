package io.github.yok.psfpr.out;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * 画像ストアの 1 枚をそのまま PNG ファイルとして保存するクラスです。
 */
@Slf4j
public final class PngArtifactWriter implements ReportWriter {

    private final ArtifactName artifact;

    private final String suffix;

    /**
     * 生成します。
     *
     * @param artifact 保存する画像です
     * @param suffix ファイル名の末尾です（例: {@code _pr_results.png}）
     */
    public PngArtifactWriter(ArtifactName artifact, String suffix) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact は null 不可です");
        }
        if (suffix == null || suffix.isEmpty()) {
            throw new IllegalArgumentException("suffix は必須です");
        }
        this.artifact = artifact;
        this.suffix = suffix;
    }

    @Override
    public String fileSuffix() {
        return suffix;
    }

    @Override
    public void write(ReportContext context, Path file) {
        byte[] png = context.artifact(artifact).orElseThrow(
                () -> new ReportWriteException(file, artifact + " の画像がまだ生成されていません"));
        try {
            Files.write(file, png);
        } catch (IOException e) {
            throw new ReportWriteException(file, "PNG の出力に失敗しました", e);
        }
        log.info("PNG を出力しました: {}", file);
    }
}
