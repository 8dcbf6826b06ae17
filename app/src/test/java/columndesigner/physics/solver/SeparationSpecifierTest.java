package columndesigner.physics.solver;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.exception.SpecificationException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.domain.separation.SeparationTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SeparationSpecifierTest {

    private double[] z;
    private double[] alpha;
    private SeparationTarget target;

    @BeforeEach
    void setUp() {
        ColumnDesignConfig config = ColumnDesignConfig.getReferenceCase();
        z = CompositionNormalizer.normalize(config.feed().composition());
        alpha = config.relativeVolatilities();
        target = config.separation();
    }

    @Test
    @DisplayName("Caso de referencia: D y B del balance de materia")
    void specify_referenceCase() {
        SeparationSpec spec = SeparationSpecifier.specify(1000.0, z, alpha, target);

        assertEquals(314.75, spec.distillateFlow(), 1e-9);
        assertEquals(685.25, spec.bottomsFlow(), 1e-9);
        assertEquals(2, spec.lightKeyIndex());
        assertEquals(3, spec.heavyKeyIndex());
    }

    @Test
    @DisplayName("El balance se cumple componente a componente y las composiciones suman 1")
    void specify_closesMaterialBalance() {
        SeparationSpec spec = SeparationSpecifier.specify(1000.0, z, alpha, target);

        double[] f = spec.feedFlows();
        double[] d = spec.distillateFlows();
        double[] b = spec.bottomsFlows();
        for (int i = 0; i < f.length; i++) {
            assertEquals(f[i], d[i] + b[i], 1e-9, "Balance del componente " + i);
            assertTrue(d[i] >= 0 && b[i] >= 0);
        }
        assertEquals(spec.feedFlow(), spec.distillateFlow() + spec.bottomsFlow(), 1e-9);
        assertEquals(1.0, Arrays.stream(spec.distillateComposition()).sum(), 1e-12);
        assertEquals(1.0, Arrays.stream(spec.bottomsComposition()).sum(), 1e-12);
    }

    @Test
    @DisplayName("Sin vector explícito, los no clave se reparten de forma nítida")
    void specify_withKeyRecoveriesOnly() {
        SeparationTarget keysOnly = target.withDistillateRecoveries(null);

        SeparationSpec spec = SeparationSpecifier.specify(1000.0, z, alpha, keysOnly);

        double[] d = spec.distillateFlows();
        assertEquals(50.0, d[0], 1e-9);
        assertEquals(100.0, d[1], 1e-9);
        assertEquals(150.0, d[2], 1e-9);
        assertEquals(15.0, d[3], 1e-9);
        assertEquals(0.0, d[4], 1e-12);
    }

    @Test
    @DisplayName("Claves no adyacentes, invertidas o fuera de rango se rechazan")
    void specify_rejectsInvalidKeys() {
        assertThrows(SpecificationException.class,
                () -> SeparationSpecifier.specify(1000.0, z, alpha, target.withHeavyKeyIndex(4)));
        assertThrows(SpecificationException.class,
                () -> SeparationSpecifier.specify(1000.0, z, alpha, target.withLightKeyIndex(4).withHeavyKeyIndex(5)));

        double[] inverted = {3.0, 2.3, 1.0, 1.3, 0.9};
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(1000.0, z, inverted, target));
    }

    @Test
    @DisplayName("Recuperaciones fuera de [0, 1], vectores desalineados o caudales inválidos se rechazan")
    void specify_rejectsInvalidInputs() {
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(1000.0, z, alpha,
                target.withDistillateRecoveries(new double[]{1.2, 1.0, 0.6, 0.05, 0.0})));
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(1000.0, z, alpha,
                target.withDistillateRecoveries(new double[]{1.0, 0.6, 0.05})));
        assertThrows(SpecificationException.class,
                () -> SeparationSpecifier.specify(1000.0, z, new double[]{3.0, 2.0}, target));
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(0.0, z, alpha, target));
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(Double.NaN, z, alpha, target));
    }

    @Test
    @DisplayName("Un producto vacío se rechaza")
    void specify_rejectsEmptyProduct() {
        double[] nothingUp = {0.0, 0.0, 0.0, 0.0, 0.0};
        assertThrows(SpecificationException.class, () -> SeparationSpecifier.specify(1000.0, z, alpha,
                target.withLightKeyRecovery(0.0).withHeavyKeyRecovery(0.0).withDistillateRecoveries(nothingUp)));
    }

    @Test
    @DisplayName("Recuperaciones de las claves que contradicen el vector completo se rechazan")
    void specify_rejectsContradictoryKeyRecoveries() {
        // El vector de referencia da 0.60 al LK y 0.05 al HK
        assertThrows(SpecificationException.class,
                () -> SeparationSpecifier.specify(1000.0, z, alpha, target.withLightKeyRecovery(0.95)));
        assertThrows(SpecificationException.class,
                () -> SeparationSpecifier.specify(1000.0, z, alpha, target.withHeavyKeyRecovery(0.01)));

        // Coherentes: se acepta
        SeparationSpec spec = SeparationSpecifier.specify(1000.0, z, alpha,
                target.withLightKeyRecovery(0.95)
                        .withDistillateRecoveries(new double[]{0.999, 0.995, 0.95, 0.05, 0.001}));
        assertEquals(0.95 * 250.0, spec.distillateFlows()[2], 1e-9);
    }
}
