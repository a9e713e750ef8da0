package io.github.yok.psfpr.app;

import io.github.yok.psfpr.core.acquisition.AcquisitionService;
import io.github.yok.psfpr.core.acquisition.OmeTiffAcquisitionService;
import io.github.yok.psfpr.core.acquisition.OmeXmlMetadataParser;
import io.github.yok.psfpr.core.run.ConvergencePolicy;
import io.github.yok.psfpr.core.run.RunCoordinator;
import io.github.yok.psfpr.core.solver.GerchbergSaxtonSolver;
import io.github.yok.psfpr.core.solver.PhaseRetrievalSolver;
import io.github.yok.psfpr.core.solver.ZernikeLeastSquaresFitter;
import io.github.yok.psfpr.core.zernike.ResultClassifier;
import io.github.yok.psfpr.out.ArtifactName;
import io.github.yok.psfpr.out.ArtifactPublisher;
import io.github.yok.psfpr.out.ArtifactRenderer;
import io.github.yok.psfpr.out.CsvCoefficientWriter;
import io.github.yok.psfpr.out.ImageArtifactStore;
import io.github.yok.psfpr.out.JFreeChartArtifactRenderer;
import io.github.yok.psfpr.out.PdfReportWriter;
import io.github.yok.psfpr.out.PngArtifactWriter;
import io.github.yok.psfpr.out.ReportEmitter;
import io.github.yok.psfpr.out.XlsxReportWriter;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PSF 読み込み・位相回復・レポート出力一式の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class PhaseRetrievalConfiguration {

    /**
     * psf-phase-retrieval の設定値（psfpr.*）です。
     */
    private final PsfRetrievalProperties p;

    /**
     * PSF 取得サービスを生成します。アプリケーション終了時に close されます。
     *
     * @return 取得サービスです
     */
    @Bean(destroyMethod = "close")
    public AcquisitionService acquisitionService() {
        return new OmeTiffAcquisitionService(new OmeXmlMetadataParser());
    }

    /**
     * 位相回復ソルバを生成します。
     *
     * @return ソルバです
     */
    @Bean
    public PhaseRetrievalSolver phaseRetrievalSolver() {
        return new GerchbergSaxtonSolver(new ZernikeLeastSquaresFitter());
    }

    /**
     * 画像ストアを生成します。
     *
     * @return 画像ストアです
     */
    @Bean
    public ImageArtifactStore imageArtifactStore() {
        return new ImageArtifactStore();
    }

    /**
     * 画像生成器を生成します。
     *
     * @return 画像生成器です
     */
    @Bean
    public ArtifactRenderer artifactRenderer() {
        return new JFreeChartArtifactRenderer();
    }

    /**
     * 画像の公開ロジックを生成します。
     *
     * @param store 画像ストアです
     * @param renderer 画像生成器です
     * @return 公開ロジックです
     */
    @Bean
    public ArtifactPublisher artifactPublisher(ImageArtifactStore store,
            ArtifactRenderer renderer) {
        return new ArtifactPublisher(store, renderer);
    }

    /**
     * 実行コーディネータを生成します。アプリケーション終了時に実行中の処理へキャンセルを要求します。
     *
     * @param solver ソルバです
     * @param publisher 途中結果の描画先です
     * @return コーディネータです
     */
    @Bean(destroyMethod = "close")
    public RunCoordinator runCoordinator(PhaseRetrievalSolver solver,
            ArtifactPublisher publisher) {
        PsfRetrievalProperties.Run r = p.getRun();
        return new RunCoordinator(solver, new ConvergencePolicy(), publisher,
                r.getRenderEveryIterations(), r.getZernikeTerms());
    }

    /**
     * 係数の分類ロジックを生成します。
     *
     * @return 分類ロジックです
     */
    @Bean
    public ResultClassifier resultClassifier() {
        return new ResultClassifier();
    }

    /**
     * レポート出力ロジックを生成します。
     *
     * @param coordinator 実行コーディネータです（実行中の出力拒否に使います）
     * @return レポート出力ロジックです
     */
    @Bean
    public ReportEmitter reportEmitter(RunCoordinator coordinator) {
        return new ReportEmitter(Arrays.asList(new XlsxReportWriter(), new PdfReportWriter(),
                new CsvCoefficientWriter(),
                new PngArtifactWriter(ArtifactName.FIT_RESULT, "_pr_results.png"),
                new PngArtifactWriter(ArtifactName.DECOMPOSITION, "_zd_results.png")),
                coordinator::isActive);
    }
}
