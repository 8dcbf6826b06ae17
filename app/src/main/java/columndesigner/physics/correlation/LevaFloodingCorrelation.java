package columndesigner.physics.correlation;

/**
 * Correlación generalizada de inundación de Leva para rellenos aleatorios.
 * <p>
 * El parámetro de capacidad se ajusta como un polinomio cúbico en ln(F_LV) y la velocidad
 * de inundación se obtiene con las correcciones de densidad (F1) y viscosidad (F2) del
 * líquido, en unidades inglesas:
 * <pre>
 *   Y        = exp(-3.7121 - 1.0371·lnF - 0.1501·lnF² - 0.007544·lnF³)
 *   F1       = -0.8787 + 2.6776·(ρ_H2O/ρ_L) - 0.6313·(ρ_H2O/ρ_L)²
 *   F2       = 0.96 · μ_L^0.19
 *   u_flood  = √(g · Y · (ρ_H2O/ρ_V) / (Fp · F1 · F2))   [ft/s]
 * </pre>
 */
public final class LevaFloodingCorrelation {

    public static final double MIN_FLOW_PARAMETER = 0.005;
    public static final double MAX_FLOW_PARAMETER = 10.0;

    private static final double WATER_DENSITY = 995.6; // kg/m³
    private static final double GRAVITY_FT_S2 = 32.2;
    private static final double FT_TO_M = 0.3048;

    private LevaFloodingCorrelation() {
    }

    public static boolean isWithinRange(double flowParameter) {
        return flowParameter >= MIN_FLOW_PARAMETER && flowParameter <= MAX_FLOW_PARAMETER;
    }

    /**
     * Parámetro de capacidad Y para un F_LV dentro del rango de la correlación.
     */
    public static double capacityParameter(double flowParameter) {
        if (!isWithinRange(flowParameter)) {
            throw new IllegalArgumentException(String.format(
                    "F_LV=%.5f fuera del rango de Leva [%.3f, %.1f].", flowParameter, MIN_FLOW_PARAMETER, MAX_FLOW_PARAMETER));
        }
        double lnF = Math.log(flowParameter);
        return Math.exp(-3.7121 - 1.0371 * lnF - 0.1501 * lnF * lnF - 0.007544 * lnF * lnF * lnF);
    }

    /**
     * Velocidad superficial de inundación del vapor.
     *
     * @param capacityParameter Y de {@link #capacityParameter(double)}.
     * @param vaporDensity      ρ_V [kg/m³].
     * @param liquidDensity     ρ_L [kg/m³].
     * @param liquidViscosityCp μ_L [cP].
     * @param packingFactor     Fp [ft⁻¹].
     * @return Velocidad de inundación [m/s].
     */
    public static double floodingVelocity(double capacityParameter, double vaporDensity, double liquidDensity,
                                          double liquidViscosityCp, double packingFactor) {
        double densityRatio = WATER_DENSITY / liquidDensity;
        double f1 = -0.8787 + 2.6776 * densityRatio - 0.6313 * densityRatio * densityRatio;
        double f2 = 0.96 * Math.pow(liquidViscosityCp, 0.19);
        if (!(f1 > 0)) {
            throw new IllegalArgumentException(String.format(
                    "Corrección de densidad F1=%.4f no positiva para rho_L=%.1f kg/m3.", f1, liquidDensity));
        }
        double floodFtPerSecond = Math.sqrt(GRAVITY_FT_S2 * capacityParameter * (WATER_DENSITY / vaporDensity)
                / (packingFactor * f1 * f2));
        return floodFtPerSecond * FT_TO_M;
    }

    public static double feetToMeters(double feet) {
        return feet * FT_TO_M;
    }
}
