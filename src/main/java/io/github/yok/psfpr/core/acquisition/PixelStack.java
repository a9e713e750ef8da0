package io.github.yok.psfpr.core.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 3 次元 PSF 画像（z, y, x）を平坦な配列で保持するクラスです。
 *
 * <p>
 * インデックスは {@code (z * ySize + y) * xSize + x} です。生成後は不変として扱います。
 * </p>
 */
public final class PixelStack {

    private final int zSize;
    private final int ySize;
    private final int xSize;
    private final double[] data;

    /**
     * 画素スタックを生成します。
     *
     * @param zSize z 方向枚数（1 以上）
     * @param ySize y 方向画素数（1 以上）
     * @param xSize x 方向画素数（1 以上）
     * @param data 画素値です（長さは zSize * ySize * xSize）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public PixelStack(int zSize, int ySize, int xSize, double[] data) {
        checkArgument(zSize > 0 && ySize > 0 && xSize > 0,
                "画素スタックの各次元は 1 以上を指定してください: %s x %s x %s", zSize, ySize, xSize);
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        checkArgument(data.length == zSize * ySize * xSize,
                "data の長さが形状と一致しません: length=%s, shape=(%s, %s, %s)", data.length, zSize,
                ySize, xSize);
        this.zSize = zSize;
        this.ySize = ySize;
        this.xSize = xSize;
        this.data = data.clone();
    }

    /**
     * 3 次元配列 {@code [z][y][x]} から生成します。
     *
     * @param planes 画素値です（各面は同じ形状であること）
     * @return 画素スタックです
     * @throws IllegalArgumentException 形状が揃っていない場合に発生します
     */
    public static PixelStack of(double[][][] planes) {
        if (planes == null || planes.length == 0 || planes[0].length == 0) {
            throw new IllegalArgumentException("planes は空にできません");
        }
        int nz = planes.length;
        int ny = planes[0].length;
        int nx = planes[0][0].length;
        double[] flat = new double[nz * ny * nx];
        for (int z = 0; z < nz; z++) {
            checkArgument(planes[z].length == ny, "z=%s の行数が不一致です", z);
            for (int y = 0; y < ny; y++) {
                checkArgument(planes[z][y].length == nx, "z=%s, y=%s の列数が不一致です", z, y);
                System.arraycopy(planes[z][y], 0, flat, (z * ny + y) * nx, nx);
            }
        }
        return new PixelStack(nz, ny, nx, flat);
    }

    public int zSize() {
        return zSize;
    }

    public int ySize() {
        return ySize;
    }

    public int xSize() {
        return xSize;
    }

    /**
     * 形状 {@code (z, y, x)} を返します。
     *
     * @return 形状です
     */
    public int[] shape() {
        return new int[] {zSize, ySize, xSize};
    }

    /**
     * 画素値を返します。
     *
     * @param z z インデックスです
     * @param y y インデックスです
     * @param x x インデックスです
     * @return 画素値です
     */
    public double get(int z, int y, int x) {
        return data[(z * ySize + y) * xSize + x];
    }

    /**
     * 1 枚の xy 断面を {@code [y][x]} で返します。
     *
     * @param z z インデックスです
     * @return xy 断面のコピーです
     */
    public double[][] plane(int z) {
        checkArgument(z >= 0 && z < zSize, "z が範囲外です: %s", z);
        double[][] p = new double[ySize][xSize];
        for (int y = 0; y < ySize; y++) {
            System.arraycopy(data, (z * ySize + y) * xSize, p[y], 0, xSize);
        }
        return p;
    }

    /**
     * 指定 y 位置の xz 断面を {@code [z][x]} で返します。
     *
     * @param y y インデックスです
     * @return xz 断面のコピーです
     */
    public double[][] sliceXz(int y) {
        checkArgument(y >= 0 && y < ySize, "y が範囲外です: %s", y);
        double[][] p = new double[zSize][xSize];
        for (int z = 0; z < zSize; z++) {
            System.arraycopy(data, (z * ySize + y) * xSize, p[z], 0, xSize);
        }
        return p;
    }
}
