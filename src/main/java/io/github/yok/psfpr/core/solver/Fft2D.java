package io.github.yok.psfpr.core.solver;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 正方格子上の 2 次元 FFT（基数 2）です。
 *
 * <p>
 * 実部・虚部を別々の配列（行優先、長さ {@code n * n}）で受け取り、その場で変換します。 逆変換は {@code 1 / n^2}
 * で正規化します。
 * </p>
 */
public final class Fft2D {

    private final int n;
    private final double[] cos;
    private final double[] sin;
    private final int[] bitReverse;

    /**
     * 変換器を生成します。
     *
     * @param n 一辺の長さ（2 の冪）です
     * @throws IllegalArgumentException n が 2 の冪でない場合に発生します
     */
    public Fft2D(int n) {
        checkArgument(n > 0 && Integer.bitCount(n) == 1, "FFT サイズは 2 の冪が必要です: %s", n);
        this.n = n;
        this.cos = new double[n / 2];
        this.sin = new double[n / 2];
        for (int i = 0; i < n / 2; i++) {
            cos[i] = Math.cos(-2.0 * Math.PI * i / n);
            sin[i] = Math.sin(-2.0 * Math.PI * i / n);
        }
        this.bitReverse = new int[n];
        int bits = Integer.numberOfTrailingZeros(n);
        for (int i = 0; i < n; i++) {
            bitReverse[i] = bits == 0 ? 0 : Integer.reverse(i) >>> (32 - bits);
        }
    }

    public int size() {
        return n;
    }

    /**
     * 順変換を行います。
     *
     * @param re 実部です
     * @param im 虚部です
     */
    public void forward(double[] re, double[] im) {
        transform2d(re, im, false);
    }

    /**
     * 逆変換を行います。
     *
     * @param re 実部です
     * @param im 虚部です
     */
    public void inverse(double[] re, double[] im) {
        transform2d(re, im, true);
        double scale = 1.0 / ((double) n * n);
        for (int i = 0; i < re.length; i++) {
            re[i] *= scale;
            im[i] *= scale;
        }
    }

    /**
     * 零周波数を中央に移動した配列を返します（元配列は変更しません）。
     *
     * @param data 行優先の {@code n * n} 配列です
     * @param n 一辺の長さです
     * @return 並べ替えた配列です
     */
    public static double[] shift(double[] data, int n) {
        double[] out = new double[data.length];
        int h = n / 2;
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                out[((y + h) % n) * n + (x + h) % n] = data[y * n + x];
            }
        }
        return out;
    }

    private void transform2d(double[] re, double[] im, boolean inverse) {
        checkArgument(re.length == n * n && im.length == n * n, "配列長が FFT サイズと一致しません");
        double[] rowRe = new double[n];
        double[] rowIm = new double[n];

        // 1) 行方向
        for (int y = 0; y < n; y++) {
            System.arraycopy(re, y * n, rowRe, 0, n);
            System.arraycopy(im, y * n, rowIm, 0, n);
            transform1d(rowRe, rowIm, inverse);
            System.arraycopy(rowRe, 0, re, y * n, n);
            System.arraycopy(rowIm, 0, im, y * n, n);
        }

        // 2) 列方向
        for (int x = 0; x < n; x++) {
            for (int y = 0; y < n; y++) {
                rowRe[y] = re[y * n + x];
                rowIm[y] = im[y * n + x];
            }
            transform1d(rowRe, rowIm, inverse);
            for (int y = 0; y < n; y++) {
                re[y * n + x] = rowRe[y];
                im[y * n + x] = rowIm[y];
            }
        }
    }

    private void transform1d(double[] re, double[] im, boolean inverse) {
        for (int i = 0; i < n; i++) {
            int j = bitReverse[i];
            if (j > i) {
                double t = re[i];
                re[i] = re[j];
                re[j] = t;
                t = im[i];
                im[i] = im[j];
                im[j] = t;
            }
        }
        for (int len = 2; len <= n; len <<= 1) {
            int half = len / 2;
            int step = n / len;
            for (int start = 0; start < n; start += len) {
                for (int k = 0; k < half; k++) {
                    double wr = cos[k * step];
                    double wi = inverse ? -sin[k * step] : sin[k * step];
                    int a = start + k;
                    int b = a + half;
                    double tr = re[b] * wr - im[b] * wi;
                    double ti = re[b] * wi + im[b] * wr;
                    re[b] = re[a] - tr;
                    im[b] = im[a] - ti;
                    re[a] += tr;
                    im[a] += ti;
                }
            }
        }
    }
}
