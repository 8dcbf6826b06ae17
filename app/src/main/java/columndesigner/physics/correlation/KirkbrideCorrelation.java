package columndesigner.physics.correlation;

/**
 * Correlación de Kirkbride (1944) para el reparto de etapas entre rectificación y agotamiento:
 * <pre>
 *   N_R / N_S = [ (B/D) · (z_HK / z_LK) · (xB_LK / xD_HK)² ]^0.206
 * </pre>
 */
public final class KirkbrideCorrelation {

    private static final double EXPONENT = 0.206;

    /**
     * Prohibido construir esta clase utilidad
     */
    private KirkbrideCorrelation() {
    }

    /**
     * @return Cociente N_R / N_S (&gt; 0).
     * @throws IllegalArgumentException si algún argumento no es estrictamente positivo.
     */
    public static double stageRatio(double bottomsFlow, double distillateFlow,
                                    double feedHeavyKey, double feedLightKey,
                                    double bottomsLightKey, double distillateHeavyKey) {
        if (!(bottomsFlow > 0) || !(distillateFlow > 0) || !(feedHeavyKey > 0) || !(feedLightKey > 0)
                || !(bottomsLightKey > 0) || !(distillateHeavyKey > 0)) {
            throw new IllegalArgumentException("Kirkbride: todos los caudales y fracciones molares deben ser positivos.");
        }
        double keyRatio = bottomsLightKey / distillateHeavyKey;
        double group = (bottomsFlow / distillateFlow) * (feedHeavyKey / feedLightKey) * keyRatio * keyRatio;
        return Math.pow(group, EXPONENT);
    }
}
