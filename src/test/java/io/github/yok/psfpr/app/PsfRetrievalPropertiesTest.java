package io.github.yok.psfpr.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class PsfRetrievalPropertiesTest {

    private static PsfRetrievalProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("psfpr", PsfRetrievalProperties.class);
    }

    @Test
    void defaultsApplyWhenNothingIsConfigured() {
        PsfRetrievalProperties p = bind(new HashMap<>());

        assertNull(p.getInput().getFile());
        assertNull(p.getParameters().getEmissionWavelength());
        assertNull(p.getParameters().getNumericalAperture());
        assertEquals(100, p.getParameters().getMaxIterations());
        assertEquals(1e-8, p.getParameters().getPupilTolerance());
        assertEquals(1e-6, p.getParameters().getMseTolerance());
        assertEquals(0.5, p.getParameters().getPhaseTolerance());
        assertEquals(250, p.getRun().getPollIntervalMs());
        assertEquals(5, p.getRun().getRenderEveryIterations());
        assertEquals(120, p.getRun().getZernikeTerms());
        assertEquals("./out", p.getOutput().getDir());
    }

    @Test
    void kebabCaseKeysAreBound() {
        Map<String, String> values = new HashMap<>();
        values.put("psfpr.input.file", "/data/bead.ome.tif");
        values.put("psfpr.parameters.emission-wavelength", "520");
        values.put("psfpr.parameters.axial-resolution", "200");
        values.put("psfpr.parameters.max-iterations", "40");
        values.put("psfpr.run.poll-interval-ms", "100");

        PsfRetrievalProperties p = bind(values);

        assertEquals("/data/bead.ome.tif", p.getInput().getFile());
        assertEquals(520, p.getParameters().getEmissionWavelength());
        assertEquals(200, p.getParameters().getAxialResolution());
        assertEquals(40, p.getParameters().getMaxIterations());
        assertEquals(100, p.getRun().getPollIntervalMs());
    }

    @Test
    void constraintsRejectNonPositiveValues() {
        PsfRetrievalProperties p = new PsfRetrievalProperties();
        p.getParameters().setEmissionWavelength(-1);
        p.getParameters().setMaxIterations(0);
        p.getOutput().setDir("");

        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<String> paths = validator.validate(p).stream()
                    .map(ConstraintViolation::getPropertyPath).map(Object::toString)
                    .collect(Collectors.toSet());

            assertTrue(paths.contains("parameters.emissionWavelength"));
            assertTrue(paths.contains("parameters.maxIterations"));
            assertTrue(paths.contains("output.dir"));
        }
    }

    @Test
    void multilineDumpListsEverySection() {
        PsfRetrievalProperties p = new PsfRetrievalProperties();
        p.getInput().setFile("bead.ome.tif");

        String dump = p.toMultilineString();

        assertTrue(dump.contains("input:"));
        assertTrue(dump.contains("file: bead.ome.tif"));
        assertTrue(dump.contains("maxIterations: 100"));
        assertTrue(dump.contains("zernikeTerms: 120"));
        assertTrue(dump.contains("dir: ./out"));
    }
}
