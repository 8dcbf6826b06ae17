package columndesigner.physics.solver;

/**
 * Propiedades medias de la fase vapor usadas por los dos modelos de dimensionamiento.
 */
public final class VaporPhaseProperties {

    public static final double GAS_CONSTANT = 8.314; // J/(mol·K)
    public static final double ATM_TO_PA = 101325.0;

    private VaporPhaseProperties() {
    }

    /**
     * Masa molar media Σ x_i · MM_i [kg/kmol].
     */
    public static double averageMolecularWeight(double[] composition, double[] molecularWeights) {
        if (composition.length != molecularWeights.length) {
            throw new IllegalArgumentException("Composición y masas molares deben tener la misma longitud.");
        }
        double mw = 0.0;
        for (int i = 0; i < composition.length; i++) {
            mw += composition[i] * molecularWeights[i];
        }
        return mw;
    }

    /**
     * Densidad de gas ideal ρ = P·MM / (R·T) [kg/m³].
     *
     * @param pressureAtm     Presión [atm].
     * @param molecularWeight Masa molar [kg/kmol].
     * @param temperatureK    Temperatura [K].
     */
    public static double idealGasDensity(double pressureAtm, double molecularWeight, double temperatureK) {
        return pressureAtm * ATM_TO_PA * (molecularWeight / 1000.0) / (GAS_CONSTANT * temperatureK);
    }
}
