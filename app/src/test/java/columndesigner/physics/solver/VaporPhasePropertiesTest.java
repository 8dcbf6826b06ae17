package columndesigner.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VaporPhasePropertiesTest {

    @Test
    @DisplayName("Densidad de gas ideal del vapor de cabeza")
    void idealGasDensity_topVapor() {
        assertEquals(6.106721520131544, VaporPhaseProperties.idealGasDensity(2.0, 92.69861636219221, 370.0), 1e-9);
    }

    @Test
    @DisplayName("Masa molar media y vectores desalineados")
    void averageMolecularWeight() {
        assertEquals(75.0, VaporPhaseProperties.averageMolecularWeight(new double[]{0.5, 0.5}, new double[]{50.0, 100.0}), 1e-12);
        assertThrows(IllegalArgumentException.class,
                () -> VaporPhaseProperties.averageMolecularWeight(new double[]{1.0}, new double[]{50.0, 100.0}));
    }
}
