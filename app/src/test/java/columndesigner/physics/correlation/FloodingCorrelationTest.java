package columndesigner.physics.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FloodingCorrelationTest {

    @Test
    @DisplayName("Souders-Brown: velocidad de inundación y densidades inválidas")
    void soudersBrown() {
        assertEquals(0.15 * Math.sqrt((650.0 - 6.5) / 6.5), SoudersBrownCorrelation.floodingVelocity(0.15, 650.0, 6.5), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> SoudersBrownCorrelation.floodingVelocity(0.15, 5.0, 6.5));
        assertThrows(IllegalArgumentException.class, () -> SoudersBrownCorrelation.floodingVelocity(0.15, 650.0, 0.0));
    }

    @Test
    @DisplayName("Leva: parámetro de capacidad y velocidad del caso de referencia")
    void leva_referenceCase() {
        double y = LevaFloodingCorrelation.capacityParameter(0.0810624695197167);
        assertEquals(0.1445327735300032, y, 1e-9);
        assertEquals(0.71596744766847, LevaFloodingCorrelation.floodingVelocity(y, 6.106721520131544, 630.0, 0.5, 92.0), 1e-8);
    }

    @Test
    @DisplayName("Leva: F_LV fuera de rango se rechaza")
    void leva_rangeCheck() {
        assertTrue(LevaFloodingCorrelation.isWithinRange(0.005));
        assertTrue(LevaFloodingCorrelation.isWithinRange(10.0));
        assertFalse(LevaFloodingCorrelation.isWithinRange(0.004));
        assertThrows(IllegalArgumentException.class, () -> LevaFloodingCorrelation.capacityParameter(12.0));
    }

    @Test
    @DisplayName("Leva: el parámetro de capacidad decrece con F_LV")
    void leva_capacityDecreasesWithFlowParameter() {
        assertTrue(LevaFloodingCorrelation.capacityParameter(0.01) > LevaFloodingCorrelation.capacityParameter(0.1));
        assertTrue(LevaFloodingCorrelation.capacityParameter(0.1) > LevaFloodingCorrelation.capacityParameter(1.0));
    }

    @Test
    @DisplayName("Kirkbride: valor conocido y argumentos no positivos")
    void kirkbride() {
        assertEquals(1.0, KirkbrideCorrelation.stageRatio(1.0, 1.0, 0.5, 0.5, 0.1, 0.1), 1e-12);
        assertEquals(Math.pow(9.0 * 400.0, 0.206), KirkbrideCorrelation.stageRatio(900.0, 100.0, 0.5, 0.5, 0.1, 0.005), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> KirkbrideCorrelation.stageRatio(1.0, 1.0, 0.5, 0.5, 0.0, 0.1));
    }
}
