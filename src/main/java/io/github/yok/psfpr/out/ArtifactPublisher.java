package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.acquisition.PixelStack;
import io.github.yok.psfpr.core.run.ConvergenceHistory;
import io.github.yok.psfpr.core.run.ProgressRenderer;
import io.github.yok.psfpr.core.solver.PupilSnapshot;
import io.github.yok.psfpr.core.zernike.PolynomialCatalogEntry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 画像を生成して {@link ImageArtifactStore} に差し替えるクラスです。
 *
 * <p>
 * 実行中の途中結果は {@link ProgressRenderer} としてバックグラウンド処理から呼ばれます。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class ArtifactPublisher implements ProgressRenderer {

    private final ImageArtifactStore store;

    private final ArtifactRenderer renderer;

    /**
     * PSF の xy 断面（中央の z）と xz 断面（中央の y）を公開します。
     *
     * @param stack 測定 PSF です
     * @param voxelAspect z ステップと xy 画素サイズの比です
     */
    public void publishPsfPreviews(PixelStack stack, double voxelAspect) {
        if (stack == null) {
            throw new IllegalArgumentException("stack は null 不可です");
        }
        store.replace(ArtifactName.PSF_XY,
                renderer.renderSlice(stack.plane(stack.zSize() / 2), 1.0, "PSF x/y"));
        store.replace(ArtifactName.PSF_XZ,
                renderer.renderSlice(stack.sliceXz(stack.ySize() / 2), voxelAspect, "PSF x/z"));
        log.debug("PSF プレビューを更新しました");
    }

    @Override
    public void render(PupilSnapshot pupil, ConvergenceHistory history, int maxIterations) {
        if (pupil != null) {
            store.replace(ArtifactName.FIT_RESULT, renderer.renderPupil(pupil));
        }
        store.replace(ArtifactName.FIT_ERROR, renderer.renderConvergence(history.pupilDiffs(),
                history.mseDiffs(), maxIterations));
    }

    /**
     * Zernike 分解の棒グラフを公開します。
     *
     * @param catalog 分類済みのカタログです
     */
    public void publishDecomposition(List<PolynomialCatalogEntry> catalog) {
        store.replace(ArtifactName.DECOMPOSITION,
                renderer.renderDecomposition(CatalogRow.copyOf(catalog)));
    }
}
