package io.github.yok.psfpr.core.solver;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * 単位円上の標本値を Zernike 多項式で最小二乗近似するクラスです。
 */
public final class ZernikeLeastSquaresFitter {

    /**
     * 係数を求めます。
     *
     * <p>
     * 項数は {@code min(maxTerms, 標本数)} です。
     * </p>
     *
     * @param rho 正規化半径です
     * @param theta 方位角（rad）です
     * @param values 標本値です
     * @param maxTerms 最大項数（1 以上）です
     * @return Noll 次数 1 からの係数です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 最小二乗の分解に失敗した場合に発生します
     */
    public double[] fit(double[] rho, double[] theta, double[] values, int maxTerms) {
        if (rho == null || theta == null || values == null) {
            throw new IllegalArgumentException("rho/theta/values は null 不可です");
        }
        if (rho.length != theta.length || rho.length != values.length) {
            throw new IllegalArgumentException("rho/theta/values の長さが一致しません");
        }
        if (maxTerms <= 0) {
            throw new IllegalArgumentException("maxTerms は 1 以上が必要です: " + maxTerms);
        }
        int samples = values.length;
        int terms = Math.min(maxTerms, samples);
        if (terms == 0) {
            return new double[0];
        }

        // 1) 計画行列（標本 × 項）
        DMatrixRMaj a = new DMatrixRMaj(samples, terms);
        for (int i = 0; i < samples; i++) {
            for (int j = 0; j < terms; j++) {
                a.set(i, j, ZernikePolynomials.value(j + 1, rho[i], theta[i]));
            }
        }
        DMatrixRMaj b = new DMatrixRMaj(samples, 1, true, values);

        // 2) ピボット付き QR で解きます（項数が多い場合の階数落ちに対応）。
        LinearSolverDense<DMatrixRMaj> solver =
                LinearSolverFactory_DDRM.leastSquaresQrPivot(true, false);
        if (!solver.setA(a)) {
            throw new IllegalStateException("Zernike 最小二乗の分解に失敗しました（EJML）");
        }
        DMatrixRMaj x = new DMatrixRMaj(terms, 1);
        solver.solve(b, x);

        double[] coefficients = new double[terms];
        for (int j = 0; j < terms; j++) {
            coefficients[j] = x.get(j, 0);
        }
        return coefficients;
    }
}
