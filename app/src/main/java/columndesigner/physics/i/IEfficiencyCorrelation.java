package columndesigner.physics.i;

/**
 * Correlación de eficiencia global de plato.
 */
public interface IEfficiencyCorrelation extends ICorrelation {
    /**
     * @param keyRelativeVolatility α[LK]/α[HK].
     * @param feedViscosityCp       Viscosidad del líquido de alimentación [cP].
     * @return Eficiencia global η_G. El llamador comprueba que esté en (0, 1].
     */
    double overallEfficiency(double keyRelativeVolatility, double feedViscosityCp);
}
