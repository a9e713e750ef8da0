package io.github.yok.psfpr.app;

import io.github.yok.psfpr.core.acquisition.AcquisitionException;
import io.github.yok.psfpr.core.acquisition.AcquisitionService;
import io.github.yok.psfpr.core.acquisition.PsfAcquisition;
import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import io.github.yok.psfpr.core.parameter.ParameterValidationException;
import io.github.yok.psfpr.core.run.PollResult;
import io.github.yok.psfpr.core.run.ProgressState;
import io.github.yok.psfpr.core.run.RunCoordinator;
import io.github.yok.psfpr.core.run.RunHandle;
import io.github.yok.psfpr.core.run.RunResult;
import io.github.yok.psfpr.core.zernike.PolynomialCatalogEntry;
import io.github.yok.psfpr.core.zernike.ResultClassifier;
import io.github.yok.psfpr.out.ArtifactPublisher;
import io.github.yok.psfpr.out.ImageArtifactStore;
import io.github.yok.psfpr.out.ReportContext;
import io.github.yok.psfpr.out.ReportEmitter;
import io.github.yok.psfpr.out.ReportOutcome;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で PSF の位相回復を実行するクラスです。
 *
 * <p>
 * PSF を読み込み、設定値で上書きしたパラメータで位相回復をバックグラウンド実行します。 一定間隔で進捗を表示し、終了後に Zernike
 * 係数を分類してレポートを出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PsfRetrievalCliRunner implements CommandLineRunner {

    /**
     * psf-phase-retrieval の設定値（psfpr.*）です。
     */
    private final PsfRetrievalProperties properties;

    private final AcquisitionService acquisitionService;

    private final RunCoordinator coordinator;

    private final ArtifactPublisher artifactPublisher;

    private final ImageArtifactStore artifactStore;

    private final ResultClassifier classifier;

    private final ReportEmitter reportEmitter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     * @throws InterruptedException 進捗待ちの間に割り込まれた場合に発生します
     */
    @Override
    public void run(String... args) throws InterruptedException {
        String file = properties.getInput().getFile();
        if (file == null || file.isEmpty()) {
            log.info("psfpr.input.file が未指定のため、位相回復を実行しません");
            return;
        }

        System.out.println("=== psf-phase-retrieval start ===");
        System.out.print(properties.toMultilineString());

        Path psfFile = Paths.get(file);

        // 1) PSF の読み込み
        PsfAcquisition acquisition;
        try {
            acquisition = acquisitionService.acquire(psfFile);
        } catch (AcquisitionException e) {
            System.out.println("PSF を読み込めません（" + e.getKind() + "）: " + e.getMessage());
            return;
        }

        // 2) パラメータの組み立て（ファイルの値を設定値で上書き）
        FitParameters parameters = FitParameters.withDefaults();
        acquisition.applyTo(parameters);
        applyOverrides(parameters);
        artifactPublisher.publishPsfPreviews(acquisition.getPixelStack(),
                parameters.voxelAspect());

        // 3) 実行開始
        RunHandle handle;
        try {
            handle = coordinator.start(parameters, acquisition.getPixelStack());
        } catch (ParameterValidationException e) {
            System.out.println("位相回復を開始できません: " + e.getMessage());
            return;
        }

        // 4) 進捗の確認
        long interval = properties.getRun().getPollIntervalMs();
        int lastPrinted = -1;
        PollResult poll = coordinator.poll(handle);
        while (!poll.isDone()) {
            ProgressState s = poll.getProgress();
            if (s.getIteration() != lastPrinted && s.getIteration() > 0) {
                System.out.println(String.format(Locale.ROOT,
                        "反復 %d / %d: pupil diff=%.2E, mse diff=%.2E", s.getIteration(),
                        handle.getMaxIterations(), s.getPupilDiff(), s.getMseDiff()));
                lastPrinted = s.getIteration();
            }
            Thread.sleep(interval);
            poll = coordinator.poll(handle);
        }

        RunResult result = poll.getResult();
        System.out.println("結果: " + result.getProgress().getStatus().joined() + "（反復="
                + result.getProgress().getIteration() + "）");

        // 5) 分類とレポート出力
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();
        classifier.classify(result.getCoefficients(), catalog,
                parameters.value(FitParameterKey.PHASE_TOLERANCE));
        artifactPublisher.publishDecomposition(catalog);
        for (PolynomialCatalogEntry entry : catalog) {
            System.out.println(String.format(Locale.ROOT, "  %2d %-32s %6.2f %s",
                    entry.getOrder(), entry.getName(), entry.getValue(), entry.getFlag()));
        }

        ReportContext context = ReportContext.capture(psfFile.toString(), parameters,
                result.getProgress(), catalog, result.getCoefficients(), artifactStore);
        List<ReportOutcome> outcomes = reportEmitter.emit(context,
                Paths.get(properties.getOutput().getDir()), ReportEmitter.baseNameOf(psfFile));
        for (ReportOutcome o : outcomes) {
            System.out.println((o.isSuccess() ? "出力: " : "出力失敗: ") + o.getFile()
                    + (o.isSuccess() ? "" : "（" + o.getError() + "）"));
        }
    }

    /**
     * 設定ファイルで指定された PSF パラメータを反映します。
     *
     * @param parameters 反映先です
     */
    private void applyOverrides(FitParameters parameters) {
        PsfRetrievalProperties.Parameters c = properties.getParameters();
        parameters.set(FitParameterKey.EMISSION_WAVELENGTH, c.getEmissionWavelength());
        if (c.getNumericalAperture() != null) {
            parameters.set(FitParameterKey.NUMERICAL_APERTURE, c.getNumericalAperture());
        }
        if (c.getRefractiveIndex() != null) {
            parameters.set(FitParameterKey.REFRACTIVE_INDEX, c.getRefractiveIndex());
        }
        if (c.getLateralResolution() != null) {
            parameters.set(FitParameterKey.XY_RESOLUTION, c.getLateralResolution());
        }
        if (c.getAxialResolution() != null) {
            parameters.set(FitParameterKey.Z_RESOLUTION, c.getAxialResolution());
        }
        parameters.set(FitParameterKey.MAX_ITERATIONS, c.getMaxIterations());
        parameters.set(FitParameterKey.PUPIL_TOLERANCE, c.getPupilTolerance());
        parameters.set(FitParameterKey.MSE_TOLERANCE, c.getMseTolerance());
        parameters.set(FitParameterKey.PHASE_TOLERANCE, c.getPhaseTolerance());
    }
}
