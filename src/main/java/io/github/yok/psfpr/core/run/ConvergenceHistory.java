package io.github.yok.psfpr.core.run;

import java.util.Arrays;

/**
 * 反復ごとの差分の履歴です。
 *
 * <p>
 * バックグラウンド処理のみが追記し、読み出しは常にコピーを返します。
 * </p>
 */
public final class ConvergenceHistory {

    private double[] pupilDiffs = new double[16];
    private double[] mseDiffs = new double[16];
    private int size;

    /**
     * 1 反復分を追記します。
     *
     * @param pupilDiff 瞳関数差分です
     * @param mseDiff MSE 差分です
     */
    public synchronized void append(double pupilDiff, double mseDiff) {
        if (size == pupilDiffs.length) {
            pupilDiffs = Arrays.copyOf(pupilDiffs, size * 2);
            mseDiffs = Arrays.copyOf(mseDiffs, size * 2);
        }
        pupilDiffs[size] = pupilDiff;
        mseDiffs[size] = mseDiff;
        size++;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized double[] pupilDiffs() {
        return Arrays.copyOf(pupilDiffs, size);
    }

    public synchronized double[] mseDiffs() {
        return Arrays.copyOf(mseDiffs, size);
    }

    /**
     * 現時点の複製を返します。
     *
     * @return 複製です
     */
    public synchronized ConvergenceHistory copy() {
        ConvergenceHistory c = new ConvergenceHistory();
        c.pupilDiffs = Arrays.copyOf(pupilDiffs, Math.max(16, size));
        c.mseDiffs = Arrays.copyOf(mseDiffs, Math.max(16, size));
        c.size = size;
        return c;
    }
}
