package io.github.yok.psfpr.core.parameter;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FitParametersTest {

    static FitParameters complete() {
        FitParameters p = FitParameters.withDefaults();
        p.set(FitParameterKey.EMISSION_WAVELENGTH, 520);
        p.set(FitParameterKey.NUMERICAL_APERTURE, 1.4);
        p.set(FitParameterKey.REFRACTIVE_INDEX, 1.518);
        p.set(FitParameterKey.XY_RESOLUTION, 100);
        p.set(FitParameterKey.Z_RESOLUTION, 250);
        p.setXySize(4);
        p.setZSize(3);
        return p;
    }

    @Test
    void completeParametersWithMatchingShapeAreAccepted() {
        assertDoesNotThrow(() -> complete().validate(new int[] {3, 4, 4}));
    }

    @Test
    void everyMissingRequiredFieldIsReported() {
        FitParameters p = FitParameters.withDefaults();
        p.setXySize(4);
        p.setZSize(3);

        ParameterValidationException e = assertThrows(ParameterValidationException.class,
                () -> p.validate(new int[] {3, 4, 4}));

        assertTrue(e.fields().contains("wl"));
        assertTrue(e.fields().contains("na"));
        assertTrue(e.fields().contains("ni"));
        assertTrue(e.fields().contains("res"));
        assertTrue(e.fields().contains("zres"));
        assertFalse(e.fields().contains("phase_tol"));
    }

    @Test
    void phaseToleranceIsNotRequired() {
        FitParameters p = complete();
        p.set(FitParameterKey.PHASE_TOLERANCE, null);
        assertDoesNotThrow(() -> p.validate(new int[] {3, 4, 4}));
    }

    @Test
    void shapeMismatchIsRejected() {
        FitParameters p = complete();

        ParameterValidationException e = assertThrows(ParameterValidationException.class,
                () -> p.validate(new int[] {3, 4, 5}));
        assertEquals(1, e.getViolations().size());
        assertEquals("psf_data", e.fields().get(0));

        assertThrows(ParameterValidationException.class, () -> p.validate(new int[] {4, 4, 4}));
        assertThrows(ParameterValidationException.class, () -> p.validate(null));
    }

    @Test
    void nonPositiveValuesAndApertureAboveIndexAreRejected() {
        FitParameters p = complete();
        p.set(FitParameterKey.PUPIL_TOLERANCE, 0.0);
        p.set(FitParameterKey.NUMERICAL_APERTURE, 1.6);

        ParameterValidationException e = assertThrows(ParameterValidationException.class,
                () -> p.validate(new int[] {3, 4, 4}));
        assertTrue(e.fields().contains("pupil_tol"));
        assertTrue(e.fields().contains("na"));
    }

    @Test
    void integralParametersAreFloored() {
        FitParameters p = complete();
        p.set(FitParameterKey.MAX_ITERATIONS, 7.9);
        p.set(FitParameterKey.EMISSION_WAVELENGTH, 520.6);

        assertEquals(7, p.maxIterations());
        assertEquals("520", p.get(FitParameterKey.EMISSION_WAVELENGTH).displayValue());
        assertEquals("1.4", p.get(FitParameterKey.NUMERICAL_APERTURE).displayValue());
    }

    @Test
    void legendValuesUseFixedNotation() {
        FitParameters p = complete();

        assertEquals("1.0e-08", p.get(FitParameterKey.PUPIL_TOLERANCE).displayValue());
        assertEquals("1.0e-06", p.get(FitParameterKey.MSE_TOLERANCE).displayValue());
        assertEquals("1.518", p.get(FitParameterKey.REFRACTIVE_INDEX).displayValue());
        assertEquals("0.5", p.get(FitParameterKey.PHASE_TOLERANCE).displayValue());

        p.set(FitParameterKey.PHASE_TOLERANCE, 2.0);
        p.set(FitParameterKey.MSE_TOLERANCE, 2.5e-7);
        assertEquals("2", p.get(FitParameterKey.PHASE_TOLERANCE).displayValue());
        assertEquals("2.5e-07", p.get(FitParameterKey.MSE_TOLERANCE).displayValue());
    }

    @Test
    void snapshotIsIndependentOfLaterChanges() {
        FitParameters p = complete();
        FitParameters s = p.snapshot();

        p.set(FitParameterKey.EMISSION_WAVELENGTH, 600);
        p.setXySize(8);

        assertEquals(520.0, s.value(FitParameterKey.EMISSION_WAVELENGTH));
        assertEquals(4, s.getXySize());
        assertEquals(2.5, s.voxelAspect(), 1e-12);
    }

    @Test
    void unitsAreAppendedToDisplayNames() {
        assertEquals("Emission wavelength in nm",
                FitParameterKey.EMISSION_WAVELENGTH.displayNameWithUnit());
        assertEquals("Numerical aperture", FitParameterKey.NUMERICAL_APERTURE.displayNameWithUnit());
        assertEquals("Tolerable phase deviation in λ",
                FitParameterKey.PHASE_TOLERANCE.displayNameWithUnit());
    }
}
