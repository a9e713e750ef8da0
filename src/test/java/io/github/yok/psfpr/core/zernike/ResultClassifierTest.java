package io.github.yok.psfpr.core.zernike;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ResultClassifierTest {

    private final ResultClassifier classifier = new ResultClassifier();

    @Test
    void catalogStartsUnclassifiedInNollOrder() {
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();

        assertEquals(15, catalog.size());
        for (int i = 0; i < catalog.size(); i++) {
            assertEquals(i + 1, catalog.get(i).getOrder());
            assertEquals(0.0, catalog.get(i).getValue());
            assertEquals(ToleranceFlag.UNCLASSIFIED, catalog.get(i).getFlag());
        }
        assertEquals("Piston", catalog.get(0).getName());
        assertEquals("Defocus", catalog.get(3).getName());
        assertEquals("Primary Spherical", catalog.get(10).getName());
    }

    @Test
    void coefficientsAreFlaggedAgainstTolerance() {
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();

        List<PolynomialCatalogEntry> result =
                classifier.classify(new double[] {0.3, -0.6}, catalog, 0.5);

        assertSame(catalog, result);
        assertEquals(0.3, catalog.get(0).getValue());
        assertEquals(ToleranceFlag.WITHIN, catalog.get(0).getFlag());
        assertEquals(-0.6, catalog.get(1).getValue());
        assertEquals(ToleranceFlag.OUTSIDE, catalog.get(1).getFlag());
    }

    @Test
    void valueEqualToToleranceIsOutside() {
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();
        classifier.classify(new double[] {0.5}, catalog, 0.5);
        assertEquals(ToleranceFlag.OUTSIDE, catalog.get(0).getFlag());
    }

    @Test
    void shortCoefficientListLeavesTailUnclassified() {
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();

        classifier.classify(new double[] {0.1, 0.2, 0.3}, catalog, 0.5);

        for (int i = 3; i < catalog.size(); i++) {
            assertEquals(0.0, catalog.get(i).getValue());
            assertEquals(ToleranceFlag.UNCLASSIFIED, catalog.get(i).getFlag());
        }
    }

    @Test
    void longCoefficientListIsTruncatedToCatalog() {
        List<PolynomialCatalogEntry> catalog = classifier.initializeCatalog();
        double[] raw = new double[120];
        raw[14] = 0.9;
        raw[15] = 5.0;

        classifier.classify(raw, catalog, 0.5);

        assertEquals(15, catalog.size());
        assertEquals(0.9, catalog.get(14).getValue());
        assertEquals(ToleranceFlag.OUTSIDE, catalog.get(14).getFlag());
    }

    @Test
    void reinitializationResetsValuesAndKeepsOrder() {
        List<PolynomialCatalogEntry> first = classifier.initializeCatalog();
        classifier.classify(new double[] {1, 2, 3, 4, 5}, first, 0.5);

        List<PolynomialCatalogEntry> second = classifier.initializeCatalog();

        assertEquals(first.size(), second.size());
        assertEquals(first.stream().map(PolynomialCatalogEntry::getOrder).collect(Collectors.toList()),
                second.stream().map(PolynomialCatalogEntry::getOrder).collect(Collectors.toList()));
        assertTrue(second.stream().allMatch(e -> e.getValue() == 0.0
                && e.getFlag() == ToleranceFlag.UNCLASSIFIED));
    }

    @Test
    void salientOrdersAreFixed() {
        for (int order : new int[] {5, 6, 7, 8, 11}) {
            assertTrue(ResultClassifier.isSalient(order));
        }
        assertFalse(ResultClassifier.isSalient(1));
        assertFalse(ResultClassifier.isSalient(4));
        assertFalse(ResultClassifier.isSalient(12));
    }
}
