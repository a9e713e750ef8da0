package io.github.yok.psfpr.app;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * psf-phase-retrieval の設定値（psfpr.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。 PSF パラメータのうち null の項目は、PSF ファイルから読み取った値を使います。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "psfpr")
public class PsfRetrievalProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * PSF・位相回復パラメータです。
     */
    @Valid
    private Parameters parameters = new Parameters();

    /**
     * 実行制御の設定です。
     */
    @Valid
    private Run run = new Run();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "psfpr")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Parameters p = getParameters();
        Run r = getRun();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // file: PSF ファイル（OME-TIFF）
                "file", i.getFile());

        appendSection(sb, nl, "parameters",
                // emissionWavelength: 中心発光波長（nm）
                "emissionWavelength", p.getEmissionWavelength(),
                // numericalAperture / refractiveIndex / lateralResolution / axialResolution: null はファイルの値
                "numericalAperture", p.getNumericalAperture(),
                "refractiveIndex", p.getRefractiveIndex(),
                "lateralResolution", p.getLateralResolution(),
                "axialResolution", p.getAxialResolution(),
                // maxIterations: 最大反復回数
                "maxIterations", p.getMaxIterations(),
                // pupilTolerance: 瞳関数差分の打ち切り閾値
                "pupilTolerance", p.getPupilTolerance(),
                // mseTolerance: 相対 MSE 差分の打ち切り閾値
                "mseTolerance", p.getMseTolerance(),
                // phaseTolerance: Zernike 係数の許容位相ずれ（λ）
                "phaseTolerance", p.getPhaseTolerance());

        appendSection(sb, nl, "run",
                // pollIntervalMs: 進捗の確認間隔
                "pollIntervalMs", r.getPollIntervalMs(),
                // renderEveryIterations: 途中結果を描画する反復間隔
                "renderEveryIterations", r.getRenderEveryIterations(),
                // zernikeTerms: Zernike 分解の最大項数
                "zernikeTerms", r.getZernikeTerms());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int k = 0; k < kvPairs.length; k += 2) {
            String key = String.valueOf(kvPairs[k]);
            Object val = (k + 1 < kvPairs.length) ? kvPairs[k + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * PSF ファイルのパスです（未指定の場合は何もしません）。
         */
        private String file;
    }

    @Data
    public static class Parameters {

        /**
         * 中心発光波長（nm）です。PSF ファイルには含まれないため、実行時は必須です。
         */
        @Positive
        private Integer emissionWavelength;

        @Positive
        private Double numericalAperture;

        @Positive
        private Double refractiveIndex;

        /**
         * xy ボクセルサイズ（nm）です。
         */
        @Positive
        private Integer lateralResolution;

        /**
         * z ステップ（nm）です。
         */
        @Positive
        private Integer axialResolution;

        @Min(1)
        private int maxIterations = 100;

        @Positive
        private double pupilTolerance = 1e-8;

        @Positive
        private double mseTolerance = 1e-6;

        @Positive
        private double phaseTolerance = 0.5;
    }

    @Data
    public static class Run {

        /**
         * 進捗の確認間隔（ミリ秒）です。
         */
        @Min(1)
        private long pollIntervalMs = 250;

        /**
         * 途中結果を描画する反復間隔です。
         */
        @Min(1)
        private int renderEveryIterations = 5;

        /**
         * Zernike 分解の最大項数です。
         */
        @Min(1)
        private int zernikeTerms = 120;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";
    }
}
