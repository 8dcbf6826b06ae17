package columndesigner.physics.sizing;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.config.PackingDesignConditions;
import columndesigner.domain.design.PackedColumnSizing;
import columndesigner.domain.exception.InvalidSizingInputException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.solver.CompositionNormalizer;
import columndesigner.physics.solver.SeparationSpecifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PackedColumnSizerTest {

    private static final double[] MW = {72.15, 86.18, 100.21, 128.26, 142.29};
    private static final double RR = 4.661006013242058;
    private static final double N_TEO = 20.27359125270841;

    private PackedColumnSizer sizer;
    private SeparationSpec spec;
    private PackingDesignConditions conditions;

    @BeforeEach
    void setUp() {
        ColumnDesignConfig config = ColumnDesignConfig.getReferenceCase();
        double[] z = CompositionNormalizer.normalize(config.feed().composition());
        spec = SeparationSpecifier.specify(1000.0, z, config.relativeVolatilities(), config.separation());
        conditions = PackingDesignConditions.getIntaloxSaddlesDefaults();
        sizer = new PackedColumnSizer();
    }

    @Test
    @DisplayName("Caso de referencia: Intalox 1\" con Leva")
    void size_referenceCase() {
        PackedColumnSizing result = sizer.size(spec, RR, N_TEO, 2.0, MW, conditions);

        assertEquals(conditions.packingName(), result.packingName());
        assertEquals(6.106721520131544, result.vaporDensity(), 1e-9);
        assertEquals(0.0810624695197167, result.flowParameter(), 1e-10);
        assertEquals(0.1445327735300032, result.capacityParameter(), 1e-9);
        assertEquals(0.71596744766847, result.floodingVelocity(), 1e-8);
        assertEquals(0.70 * 0.71596744766847, result.operatingVelocity(), 1e-8);
        assertEquals(4.368882815438809, result.diameter(), 1e-6);
        assertEquals(9.269085920738284, result.packedHeight(), 1e-9);
        assertEquals(11.269085920738284, result.totalHeight(), 1e-9);
    }

    @Test
    @DisplayName("La altura de lecho es proporcional a N_teo")
    void size_packedHeightScalesWithStages() {
        double h1 = sizer.size(spec, RR, 10.0, 2.0, MW, conditions).packedHeight();
        double h2 = sizer.size(spec, RR, 20.0, 2.0, MW, conditions).packedHeight();
        assertEquals(2.0 * h1, h2, 1e-12);
        assertEquals(10.0 * 1.5 * 0.3048, h1, 1e-12);
    }

    @Test
    @DisplayName("F_LV fuera del rango de Leva se rechaza")
    void size_rejectsFlowParameterOutOfRange() {
        // RR muy bajo: L/V → 0 y F_LV < 0.005
        assertThrows(InvalidSizingInputException.class, () -> sizer.size(spec, 0.01, N_TEO, 2.0, MW, conditions));
    }

    @Test
    @DisplayName("Entradas físicas inválidas se rechazan")
    void size_rejectsInvalidInputs() {
        assertThrows(InvalidSizingInputException.class, () -> sizer.size(spec, RR, 0.0, 2.0, MW, conditions));
        assertThrows(InvalidSizingInputException.class,
                () -> sizer.size(spec, RR, N_TEO, 2.0, MW, conditions.withFloodFraction(0.0)));
        assertThrows(InvalidSizingInputException.class,
                () -> sizer.size(spec, RR, N_TEO, 2.0, MW, conditions.withPackingFactor(-92.0)));
        assertThrows(InvalidSizingInputException.class,
                () -> sizer.size(spec, RR, N_TEO, 2.0, MW, conditions.withLiquidDensity(5.0)));
        // ρ_L tan alta que la corrección de densidad F1 deja de ser positiva
        assertThrows(InvalidSizingInputException.class,
                () -> sizer.size(spec, RR, N_TEO, 2.0, MW, conditions.withLiquidDensity(4000.0)));
    }
}
