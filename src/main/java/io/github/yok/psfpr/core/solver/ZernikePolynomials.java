package io.github.yok.psfpr.core.solver;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Noll 順の Zernike 多項式を評価するユーティリティです。
 *
 * <p>
 * Noll の正規化（単位円上で二乗平均 1）に従います。{@code m > 0} は cos、{@code m < 0} は sin です。
 * </p>
 */
public final class ZernikePolynomials {

    private ZernikePolynomials() {}

    /**
     * Noll 番号を {@code (n, m)} に変換します。
     *
     * @param j Noll 番号（1 以上）です
     * @return {@code {n, m}} です
     * @throws IllegalArgumentException j が 1 未満の場合に発生します
     */
    public static int[] nollToNm(int j) {
        checkArgument(j >= 1, "Noll 番号は 1 以上が必要です: %s", j);
        int n = 0;
        int j1 = j - 1;
        while (j1 > n) {
            n++;
            j1 -= n;
        }
        int sign = (j % 2 == 0) ? 1 : -1;
        int m = sign * ((n % 2) + 2 * ((j1 + ((n + 1) % 2)) / 2));
        return new int[] {n, m};
    }

    /**
     * 多項式の値を返します。
     *
     * @param j Noll 番号です
     * @param rho 正規化半径（0〜1）です
     * @param theta 方位角（rad）です
     * @return 値です
     */
    public static double value(int j, double rho, double theta) {
        int[] nm = nollToNm(j);
        int n = nm[0];
        int m = nm[1];
        int am = Math.abs(m);
        double r = radial(n, am, rho);
        if (m == 0) {
            return Math.sqrt(n + 1.0) * r;
        }
        double norm = Math.sqrt(2.0 * (n + 1.0));
        return m > 0 ? norm * r * Math.cos(am * theta) : norm * r * Math.sin(am * theta);
    }

    /**
     * 動径多項式 {@code R_n^m(rho)} を返します。
     */
    static double radial(int n, int m, double rho) {
        double sum = 0.0;
        for (int k = 0; k <= (n - m) / 2; k++) {
            double c = factorial(n - k)
                    / (factorial(k) * factorial((n + m) / 2 - k) * factorial((n - m) / 2 - k));
            if (k % 2 == 1) {
                c = -c;
            }
            sum += c * Math.pow(rho, n - 2 * k);
        }
        return sum;
    }

    private static double factorial(int k) {
        double f = 1.0;
        for (int i = 2; i <= k; i++) {
            f *= i;
        }
        return f;
    }
}
