package io.github.yok.psfpr.out;

import io.github.yok.psfpr.core.solver.PupilSnapshot;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Paint;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.LogAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.GrayPaintScale;
import org.jfree.chart.renderer.PaintScale;
import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.xy.XYBlockRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.xy.DefaultXYZDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * JFreeChart で各種画像を PNG として生成するクラスです。
 */
public final class JFreeChartArtifactRenderer implements ArtifactRenderer {

    private static final int PREVIEW_SIZE = 400;
    private static final int PUPIL_PANEL_WIDTH = 480;
    private static final int PUPIL_HEIGHT = 400;
    private static final int CONVERGENCE_WIDTH = 800;
    private static final int CONVERGENCE_HEIGHT = 200;
    private static final int DECOMPOSITION_SIZE = 600;

    private static final Color SALIENT = new Color(0xC0, 0x39, 0x2B);
    private static final Color NORMAL = new Color(0x2E, 0x86, 0xC1);

    @Override
    public byte[] renderSlice(double[][] plane, double aspect, String title) {
        if (plane == null || plane.length == 0) {
            throw new IllegalArgumentException("plane は空にできません");
        }
        JFreeChart chart = heatmap(plane, aspect, title, sliceScale(plane));
        return toPng(chart, PREVIEW_SIZE, PREVIEW_SIZE);
    }

    /**
     * 断面の最小値から最大値までの濃淡スケールを返します。一様な断面でも上限は下限より大きくなります。
     *
     * @param plane 断面です
     * @return 濃淡スケールです
     */
    static GrayPaintScale sliceScale(double[][] plane) {
        double lo = min(plane);
        double hi = max(plane);
        return new GrayPaintScale(lo, hi > lo ? hi : Math.nextUp(lo));
    }

    @Override
    public byte[] renderPupil(PupilSnapshot pupil) {
        if (pupil == null) {
            throw new IllegalArgumentException("pupil は null 不可です");
        }
        double[][] magnitude = crop(pupil.getMagnitude(), pupil.getMask(), pupil.getSize());
        double[][] phase = crop(pupil.getPhase(), pupil.getMask(), pupil.getSize());

        double magMax = max(magnitude);
        JFreeChart magChart = heatmap(magnitude, 1.0, "Magnitude",
                new GrayPaintScale(0.0, magMax > 0.0 ? magMax : Double.MIN_VALUE));
        JFreeChart phaseChart = heatmap(phase, 1.0, "Phase",
                new GrayPaintScale(-Math.PI, Math.PI));

        // 振幅と位相を横に並べた 1 枚にします。
        BufferedImage panel = new BufferedImage(PUPIL_PANEL_WIDTH * 2, PUPIL_HEIGHT,
                BufferedImage.TYPE_INT_RGB);
        Graphics2D g = panel.createGraphics();
        try {
            g.drawImage(magChart.createBufferedImage(PUPIL_PANEL_WIDTH, PUPIL_HEIGHT), 0, 0, null);
            g.drawImage(phaseChart.createBufferedImage(PUPIL_PANEL_WIDTH, PUPIL_HEIGHT),
                    PUPIL_PANEL_WIDTH, 0, null);
        } finally {
            g.dispose();
        }
        try {
            return ChartUtils.encodeAsPNG(panel);
        } catch (IOException e) {
            throw new UncheckedIOException("瞳関数画像のエンコードに失敗しました", e);
        }
    }

    @Override
    public byte[] renderConvergence(double[] pupilDiffs, double[] mseDiffs, int maxIterations) {
        XYSeries pupil = new XYSeries("Pupil function difference");
        XYSeries mse = new XYSeries("Relative MSE difference");
        addPositive(pupil, pupilDiffs);
        addPositive(mse, mseDiffs);
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(pupil);
        dataset.addSeries(mse);

        JFreeChart chart = ChartFactory.createXYLineChart(null, "Iteration", "Difference",
                dataset, PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.white);
        plot.setRangeGridlinesVisible(false);
        plot.setDomainGridlinesVisible(false);
        LogAxis axis = new LogAxis("Difference");
        axis.setSmallestValue(1e-16);
        plot.setRangeAxis(axis);
        NumberAxis domain = (NumberAxis) plot.getDomainAxis();
        domain.setRange(0, Math.max(1, maxIterations));
        plot.setRenderer(new XYLineAndShapeRenderer(true, false));
        chart.setBackgroundPaint(Color.white);
        return toPng(chart, CONVERGENCE_WIDTH, CONVERGENCE_HEIGHT);
    }

    @Override
    public byte[] renderDecomposition(List<CatalogRow> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows は null 不可です");
        }
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (CatalogRow row : rows) {
            dataset.addValue(row.getValue(), "Zernike", row.getName());
        }
        JFreeChart chart = ChartFactory.createBarChart(null, null, "Phase coefficient / λ",
                dataset, PlotOrientation.HORIZONTAL, false, false, false);
        CategoryPlot plot = chart.getCategoryPlot();
        plot.setBackgroundPaint(Color.white);
        plot.setRenderer(new SalientBarRenderer(rows));
        chart.setBackgroundPaint(Color.white);
        return toPng(chart, DECOMPOSITION_SIZE, DECOMPOSITION_SIZE);
    }

    private static JFreeChart heatmap(double[][] plane, double aspect, String title,
            PaintScale scale) {
        int rows = plane.length;
        int cols = plane[0].length;
        double[] xs = new double[rows * cols];
        double[] ys = new double[rows * cols];
        double[] zs = new double[rows * cols];
        int k = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                xs[k] = c;
                ys[k] = r * aspect;
                zs[k] = plane[r][c];
                k++;
            }
        }
        DefaultXYZDataset dataset = new DefaultXYZDataset();
        dataset.addSeries(title, new double[][] {xs, ys, zs});

        XYBlockRenderer renderer = new XYBlockRenderer();
        renderer.setBlockHeight(aspect);
        renderer.setPaintScale(scale);

        NumberAxis xAxis = new NumberAxis();
        xAxis.setVisible(false);
        xAxis.setRange(-0.5, cols - 0.5);
        NumberAxis yAxis = new NumberAxis();
        yAxis.setVisible(false);
        yAxis.setRange(-0.5 * aspect, (rows - 0.5) * aspect);
        yAxis.setInverted(true);

        XYPlot plot = new XYPlot(dataset, xAxis, yAxis, renderer);
        plot.setBackgroundPaint(Color.black);
        plot.setDomainGridlinesVisible(false);
        plot.setRangeGridlinesVisible(false);
        JFreeChart chart = new JFreeChart(title, JFreeChart.DEFAULT_TITLE_FONT, plot, false);
        chart.setBackgroundPaint(Color.white);
        return chart;
    }

    /**
     * 開口を囲む最小の正方領域を切り出します。
     */
    private static double[][] crop(double[] values, boolean[] mask, int size) {
        int lo = size;
        int hi = -1;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                if (mask[y * size + x]) {
                    lo = Math.min(lo, Math.min(x, y));
                    hi = Math.max(hi, Math.max(x, y));
                }
            }
        }
        if (hi < lo) {
            lo = 0;
            hi = size - 1;
        }
        int n = hi - lo + 1;
        double[][] out = new double[n][n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                int i = (y + lo) * size + (x + lo);
                out[y][x] = mask[i] ? values[i] : 0.0;
            }
        }
        return out;
    }

    private static void addPositive(XYSeries series, double[] values) {
        if (values == null) {
            return;
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] > 0.0 && Double.isFinite(values[i])) {
                series.add(i + 1, values[i]);
            }
        }
    }

    private static double min(double[][] plane) {
        double m = Double.POSITIVE_INFINITY;
        for (double[] row : plane) {
            for (double v : row) {
                m = Math.min(m, v);
            }
        }
        return m;
    }

    private static double max(double[][] plane) {
        double m = Double.NEGATIVE_INFINITY;
        for (double[] row : plane) {
            for (double v : row) {
                m = Math.max(m, v);
            }
        }
        return m;
    }

    private static byte[] toPng(JFreeChart chart, int width, int height) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ChartUtils.writeChartAsPNG(out, chart, width, height);
        } catch (IOException e) {
            throw new UncheckedIOException("グラフのエンコードに失敗しました", e);
        }
        return out.toByteArray();
    }

    /**
     * 強調表示する多項式の棒だけ色を変えるレンダラです。
     */
    private static final class SalientBarRenderer extends BarRenderer {

        private static final long serialVersionUID = 1L;

        private final boolean[] salient;

        SalientBarRenderer(List<CatalogRow> rows) {
            this.salient = new boolean[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                salient[i] = rows.get(i).isSalient();
            }
            setShadowVisible(false);
            setDrawBarOutline(false);
        }

        @Override
        public Paint getItemPaint(int row, int column) {
            return column < salient.length && salient[column] ? SALIENT : NORMAL;
        }
    }
}
