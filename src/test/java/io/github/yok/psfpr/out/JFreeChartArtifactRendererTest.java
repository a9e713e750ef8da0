package io.github.yok.psfpr.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.jfree.chart.renderer.GrayPaintScale;
import org.junit.jupiter.api.Test;

class JFreeChartArtifactRendererTest {

    private static double[][] constant(int n, double value) {
        double[][] plane = new double[n][n];
        for (double[] row : plane) {
            Arrays.fill(row, value);
        }
        return plane;
    }

    @Test
    void saturatedUniformSliceStillHasIncreasingScale() {
        GrayPaintScale scale = JFreeChartArtifactRenderer.sliceScale(constant(8, 65535.0));

        assertEquals(65535.0, scale.getLowerBound());
        assertTrue(scale.getUpperBound() > scale.getLowerBound());
        assertNotNull(scale.getPaint(65535.0));
    }

    @Test
    void uniformZeroSliceStillHasIncreasingScale() {
        GrayPaintScale scale = JFreeChartArtifactRenderer.sliceScale(constant(4, 0.0));

        assertTrue(scale.getUpperBound() > scale.getLowerBound());
    }

    @Test
    void scaleSpansSliceRange() {
        double[][] plane = {{3.0, 10.0}, {-2.0, 7.5}};

        GrayPaintScale scale = JFreeChartArtifactRenderer.sliceScale(plane);

        assertEquals(-2.0, scale.getLowerBound());
        assertEquals(10.0, scale.getUpperBound());
    }

    @Test
    void emptySliceIsRejected() {
        JFreeChartArtifactRenderer renderer = new JFreeChartArtifactRenderer();
        assertThrows(IllegalArgumentException.class,
                () -> renderer.renderSlice(new double[0][0], 1.0, "PSF x/y"));
    }
}
