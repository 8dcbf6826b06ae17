package columndesigner.physics.i;

/**
 * Correlación de Gilliland: relaciona el exceso de reflujo sobre el mínimo con el exceso
 * de etapas sobre el mínimo.
 */
public interface IGillilandCorrelation extends ICorrelation {
    /**
     * Evalúa Y = (N - N_min) / (N + 1).
     *
     * @param x X = (RR - RR_min) / (RR + 1), en (0, 1).
     * @return Fracción Y en [0, 1].
     */
    double stageFraction(double x);
}
