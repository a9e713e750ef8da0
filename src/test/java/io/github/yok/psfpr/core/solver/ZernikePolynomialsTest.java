package io.github.yok.psfpr.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ZernikePolynomialsTest {

    @Test
    void nollIndicesMapToRadialAndAzimuthalOrders() {
        assertArrayEquals(new int[] {0, 0}, ZernikePolynomials.nollToNm(1));
        assertArrayEquals(new int[] {1, 1}, ZernikePolynomials.nollToNm(2));
        assertArrayEquals(new int[] {1, -1}, ZernikePolynomials.nollToNm(3));
        assertArrayEquals(new int[] {2, 0}, ZernikePolynomials.nollToNm(4));
        assertArrayEquals(new int[] {2, -2}, ZernikePolynomials.nollToNm(5));
        assertArrayEquals(new int[] {2, 2}, ZernikePolynomials.nollToNm(6));
        assertArrayEquals(new int[] {3, -1}, ZernikePolynomials.nollToNm(7));
        assertArrayEquals(new int[] {3, 1}, ZernikePolynomials.nollToNm(8));
        assertArrayEquals(new int[] {4, 0}, ZernikePolynomials.nollToNm(11));
        assertArrayEquals(new int[] {4, -4}, ZernikePolynomials.nollToNm(15));
    }

    @Test
    void nollIndexStartsAtOne() {
        assertThrows(IllegalArgumentException.class, () -> ZernikePolynomials.nollToNm(0));
    }

    @Test
    void radialPolynomialsMatchClosedForms() {
        double rho = 0.6;
        assertEquals(2 * rho * rho - 1, ZernikePolynomials.radial(2, 0, rho), 1e-12);
        assertEquals(3 * Math.pow(rho, 3) - 2 * rho, ZernikePolynomials.radial(3, 1, rho), 1e-12);
        assertEquals(6 * Math.pow(rho, 4) - 6 * rho * rho + 1,
                ZernikePolynomials.radial(4, 0, rho), 1e-12);
    }

    @Test
    void valuesUseNollNormalisation() {
        assertEquals(1.0, ZernikePolynomials.value(1, 0.3, 1.0), 1e-12);
        assertEquals(Math.sqrt(3.0) * (2 * 0.25 - 1), ZernikePolynomials.value(4, 0.5, 2.0),
                1e-12);
        double theta = 0.4;
        assertEquals(Math.sqrt(6.0) * 0.64 * Math.sin(2 * theta),
                ZernikePolynomials.value(5, 0.8, theta), 1e-12);
        assertEquals(Math.sqrt(6.0) * 0.64 * Math.cos(2 * theta),
                ZernikePolynomials.value(6, 0.8, theta), 1e-12);
    }
}
