package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.parameter.FitParameters;
import io.github.yok.psfpr.core.run.ProgressState;
import io.github.yok.psfpr.core.zernike.PolynomialCatalogEntry;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Value;

/**
 * レポート出力に渡す入力一式のスナップショットです。
 *
 * <p>
 * 生成時にパラメータ・カタログ・画像を複製するため、出力中に元の値が変わっても影響を受けません。
 * </p>
 */
@Value
public class ReportContext {

    /**
     * PSF ファイルのパスです。
     */
    String sourcePath;

    FitParameters parameters;

    ProgressState progress;

    List<CatalogRow> catalog;

    /**
     * ソルバが返した全係数（Noll 次数順）です。
     */
    double[] rawCoefficients;

    Map<ArtifactName, byte[]> artifacts;

    /**
     * 現在の値からスナップショットを生成します。
     *
     * @param sourcePath PSF ファイルのパスです
     * @param parameters パラメータです
     * @param progress 進捗です
     * @param catalog 分類済みのカタログです
     * @param rawCoefficients ソルバの係数です（null は空扱い）
     * @param store 画像ストアです
     * @return スナップショットです
     */
    public static ReportContext capture(String sourcePath, FitParameters parameters,
            ProgressState progress, List<PolynomialCatalogEntry> catalog, double[] rawCoefficients,
            ImageArtifactStore store) {
        if (parameters == null || progress == null || catalog == null || store == null) {
            throw new IllegalArgumentException("parameters/progress/catalog/store は null 不可です");
        }
        return new ReportContext(sourcePath == null ? "" : sourcePath, parameters.snapshot(),
                progress, CatalogRow.copyOf(catalog),
                rawCoefficients == null ? new double[0] : rawCoefficients.clone(),
                Collections.unmodifiableMap(store.snapshot()));
    }

    public double[] getRawCoefficients() {
        return rawCoefficients.clone();
    }

    /**
     * 画像を返します。
     *
     * @param name 名前です
     * @return 画像です（無い場合は空）
     */
    public Optional<byte[]> artifact(ArtifactName name) {
        return Optional.ofNullable(artifacts.get(name));
    }
}
