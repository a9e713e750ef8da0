package io.github.yok.psfpr.core.solver;

import io.github.yok.psfpr.core.acquisition.PixelStack;
import io.github.yok.psfpr.core.parameter.FitParameterKey;
import io.github.yok.psfpr.core.parameter.FitParameters;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Gerchberg-Saxton 型の反復で、測定 3 次元 PSF から瞳関数を推定するソルバです。
 *
 * <p>
 * 1 反復は以下の流れです。
 * </p>
 *
 * <ol>
 * <li>各 z 面について、瞳関数にデフォーカス位相 {@code exp(2πi kz z)} を掛けて逆 FFT し、面内の電場を求めます。</li>
 * <li>電場の振幅を測定強度の平方根で置き換え、FFT でデフォーカスを戻して瞳関数の候補を得ます。</li>
 * <li>全 z 面の候補を平均し、開口外を 0 にしたものを新しい瞳関数とします。</li>
 * </ol>
 *
 * <p>
 * 差分はそれぞれ、瞳関数の相対二乗差分と、正規化強度の MSE の相対変化です。
 * </p>
 */
@Slf4j
public final class GerchbergSaxtonSolver implements PhaseRetrievalSolver {

    private final ZernikeLeastSquaresFitter fitter;

    /**
     * ソルバを生成します。
     *
     * @param fitter Zernike 分解に使う最小二乗器です（null 不可）
     * @throws IllegalArgumentException fitter が null の場合に発生します
     */
    public GerchbergSaxtonSolver(ZernikeLeastSquaresFitter fitter) {
        if (fitter == null) {
            throw new IllegalArgumentException("fitter は null 不可です");
        }
        this.fitter = fitter;
    }

    @Override
    public PhaseRetrievalState initialize(PixelStack stack, FitParameters parameters) {
        if (stack == null) {
            throw new IllegalArgumentException("stack は null 不可です");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        double wl = parameters.value(FitParameterKey.EMISSION_WAVELENGTH);
        double na = parameters.value(FitParameterKey.NUMERICAL_APERTURE);
        double ni = parameters.value(FitParameterKey.REFRACTIVE_INDEX);
        double res = parameters.value(FitParameterKey.XY_RESOLUTION);
        double zres = parameters.value(FitParameterKey.Z_RESOLUTION);
        if (!(wl > 0.0 && na > 0.0 && ni > na && res > 0.0 && zres > 0.0)) {
            throw new SolverException("光学パラメータが不正です: wl=" + wl + ", na=" + na + ", ni=" + ni
                    + ", res=" + res + ", zres=" + zres);
        }

        int nz = stack.zSize();
        int nxy = stack.xSize();
        int size = Integer.highestOneBit(Math.max(1, 2 * nxy - 1)) << 1;
        GsState state = new GsState(size, nz);

        // 1) 測定データの前処理（背景除去・非負化・正規化・中心を原点へ配置）
        double background = borderMean(stack);
        double[] intensity = new double[nz * size * size];
        double total = 0.0;
        int h = nxy / 2;
        for (int z = 0; z < nz; z++) {
            for (int y = 0; y < nxy; y++) {
                for (int x = 0; x < nxy; x++) {
                    double v = Math.max(0.0, stack.get(z, y, x) - background);
                    int py = Math.floorMod(y - h, size);
                    int px = Math.floorMod(x - h, size);
                    intensity[(z * size + py) * size + px] = v;
                    total += v;
                }
            }
        }
        if (!(total > 0.0)) {
            throw new SolverException("背景除去後の PSF 強度がすべて 0 です");
        }
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] /= total;
            state.measuredAmplitude[i] = Math.sqrt(intensity[i]);
        }
        state.measuredIntensity = intensity;

        // 2) 瞳面の幾何（k 空間の格子・開口・kz）
        double dk = 1.0 / (size * res);
        double kMax = na / wl;
        double kMedium = ni / wl;
        for (int y = 0; y < size; y++) {
            double ky = fftFrequency(y, size) * dk;
            for (int x = 0; x < size; x++) {
                double kx = fftFrequency(x, size) * dk;
                int i = y * size + x;
                double kr = Math.hypot(kx, ky);
                state.rho[i] = kr / kMax;
                state.theta[i] = Math.atan2(ky, kx);
                state.mask[i] = kr < kMax;
                state.kz[i] = Math.sqrt(Math.max(0.0, kMedium * kMedium - kr * kr));
                if (state.mask[i]) {
                    state.pupilRe[i] = 1.0;
                    state.maskCount++;
                }
            }
        }
        if (state.maskCount == 0) {
            throw new SolverException("開口内に格子点がありません（NA・波長・画素サイズを確認してください）");
        }
        for (int z = 0; z < nz; z++) {
            state.zPositions[z] = (z - (nz - 1) / 2.0) * zres;
        }

        log.debug("位相回復を初期化しました: grid={}x{}, nz={}, 開口内格子点={}", size, size, nz,
                state.maskCount);
        return state;
    }

    @Override
    public StepResult step(PhaseRetrievalState s) {
        GsState state = cast(s);
        int size = state.size;
        int n2 = size * size;
        Fft2D fft = state.fft;

        double[] sumRe = new double[n2];
        double[] sumIm = new double[n2];
        double[] modelIntensity = new double[state.nz * n2];
        double modelTotal = 0.0;
        double[] re = new double[n2];
        double[] im = new double[n2];

        for (int z = 0; z < state.nz; z++) {
            double zPos = state.zPositions[z];

            // 1) デフォーカスを掛けて面内電場へ
            for (int i = 0; i < n2; i++) {
                if (!state.mask[i]) {
                    re[i] = 0.0;
                    im[i] = 0.0;
                    continue;
                }
                double phi = 2.0 * Math.PI * state.kz[i] * zPos;
                double c = Math.cos(phi);
                double sn = Math.sin(phi);
                re[i] = state.pupilRe[i] * c - state.pupilIm[i] * sn;
                im[i] = state.pupilRe[i] * sn + state.pupilIm[i] * c;
            }
            fft.inverse(re, im);

            // 2) 振幅を測定値で置き換え
            int offset = z * n2;
            for (int i = 0; i < n2; i++) {
                double amp = Math.hypot(re[i], im[i]);
                double model = amp * amp;
                modelIntensity[offset + i] = model;
                modelTotal += model;
                double target = state.measuredAmplitude[offset + i];
                if (amp > 0.0) {
                    re[i] = re[i] / amp * target;
                    im[i] = im[i] / amp * target;
                } else {
                    re[i] = target;
                    im[i] = 0.0;
                }
            }

            // 3) 瞳面へ戻してデフォーカスを除去
            fft.forward(re, im);
            for (int i = 0; i < n2; i++) {
                if (!state.mask[i]) {
                    continue;
                }
                double phi = -2.0 * Math.PI * state.kz[i] * zPos;
                double c = Math.cos(phi);
                double sn = Math.sin(phi);
                sumRe[i] += re[i] * c - im[i] * sn;
                sumIm[i] += re[i] * sn + im[i] * c;
            }
        }

        // 4) 平均と差分
        double diffSq = 0.0;
        double oldSq = 0.0;
        for (int i = 0; i < n2; i++) {
            double nr = state.mask[i] ? sumRe[i] / state.nz : 0.0;
            double ni = state.mask[i] ? sumIm[i] / state.nz : 0.0;
            double dr = nr - state.pupilRe[i];
            double di = ni - state.pupilIm[i];
            diffSq += dr * dr + di * di;
            oldSq += state.pupilRe[i] * state.pupilRe[i] + state.pupilIm[i] * state.pupilIm[i];
            state.pupilRe[i] = nr;
            state.pupilIm[i] = ni;
        }
        double pupilDiff = oldSq > 0.0 ? diffSq / oldSq : 1.0;

        double mse = 0.0;
        if (modelTotal > 0.0) {
            for (int i = 0; i < modelIntensity.length; i++) {
                double d = modelIntensity[i] / modelTotal - state.measuredIntensity[i];
                mse += d * d;
            }
            mse /= modelIntensity.length;
        }
        double mseDiff;
        if (Double.isNaN(state.previousMse)) {
            mseDiff = 1.0;
        } else if (mse > 0.0) {
            mseDiff = Math.abs(mse - state.previousMse) / mse;
        } else {
            mseDiff = 0.0;
        }
        state.previousMse = mse;

        if (!Double.isFinite(pupilDiff) || !Double.isFinite(mseDiff)) {
            throw new SolverException("位相回復の差分が有限値ではありません: pupilDiff=" + pupilDiff
                    + ", mseDiff=" + mseDiff);
        }
        return new StepResult(pupilDiff, mseDiff, pupilDiff == 0.0);
    }

    @Override
    public double[] decompose(PhaseRetrievalState s, int maxTerms) {
        GsState state = cast(s);
        List<Integer> indices = new ArrayList<>(state.maskCount);
        for (int i = 0; i < state.mask.length; i++) {
            if (state.mask[i]) {
                indices.add(i);
            }
        }
        double[] rho = new double[indices.size()];
        double[] theta = new double[indices.size()];
        double[] phaseWaves = new double[indices.size()];
        for (int k = 0; k < indices.size(); k++) {
            int i = indices.get(k);
            rho[k] = state.rho[i];
            theta[k] = state.theta[i];
            phaseWaves[k] = Math.atan2(state.pupilIm[i], state.pupilRe[i]) / (2.0 * Math.PI);
        }
        try {
            return fitter.fit(rho, theta, phaseWaves, maxTerms);
        } catch (IllegalStateException e) {
            throw new SolverException("Zernike 分解に失敗しました", e);
        }
    }

    private static GsState cast(PhaseRetrievalState s) {
        if (!(s instanceof GsState)) {
            throw new IllegalArgumentException("このソルバで初期化された状態ではありません: " + s);
        }
        return (GsState) s;
    }

    /**
     * 全 z 面の外周画素の平均（背景推定値）を返します。
     */
    private static double borderMean(PixelStack stack) {
        int n = stack.xSize();
        double sum = 0.0;
        long count = 0;
        for (int z = 0; z < stack.zSize(); z++) {
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    if (y == 0 || x == 0 || y == n - 1 || x == n - 1) {
                        sum += stack.get(z, y, x);
                        count++;
                    }
                }
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static double fftFrequency(int index, int n) {
        return index < (n + 1) / 2 ? index : index - n;
    }

    /**
     * Gerchberg-Saxton の内部状態です。
     */
    private static final class GsState implements PhaseRetrievalState {

        final int size;
        final int nz;
        final Fft2D fft;
        final double[] measuredAmplitude;
        double[] measuredIntensity;
        final double[] rho;
        final double[] theta;
        final double[] kz;
        final boolean[] mask;
        final double[] pupilRe;
        final double[] pupilIm;
        final double[] zPositions;
        int maskCount;
        double previousMse = Double.NaN;

        GsState(int size, int nz) {
            this.size = size;
            this.nz = nz;
            this.fft = new Fft2D(size);
            int n2 = size * size;
            this.measuredAmplitude = new double[nz * n2];
            this.rho = new double[n2];
            this.theta = new double[n2];
            this.kz = new double[n2];
            this.mask = new boolean[n2];
            this.pupilRe = new double[n2];
            this.pupilIm = new double[n2];
            this.zPositions = new double[nz];
        }

        @Override
        public PupilSnapshot snapshotPupil() {
            int n2 = size * size;
            double[] magnitude = new double[n2];
            double[] phase = new double[n2];
            double[] maskValues = new double[n2];
            for (int i = 0; i < n2; i++) {
                magnitude[i] = Math.hypot(pupilRe[i], pupilIm[i]);
                phase[i] = mask[i] ? Math.atan2(pupilIm[i], pupilRe[i]) : 0.0;
                maskValues[i] = mask[i] ? 1.0 : 0.0;
            }
            double[] shiftedMask = Fft2D.shift(maskValues, size);
            boolean[] centeredMask = new boolean[n2];
            for (int i = 0; i < n2; i++) {
                centeredMask[i] = shiftedMask[i] > 0.5;
            }
            return new PupilSnapshot(size, Fft2D.shift(magnitude, size),
                    Fft2D.shift(phase, size), centeredMask);
        }
    }
}
