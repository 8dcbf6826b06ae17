package columndesigner.physics.correlation;

/**
 * Límite de inundación de Souders-Brown para platos:
 * u_flood = C · √((ρ_L - ρ_V) / ρ_V).
 */
public final class SoudersBrownCorrelation {

    private SoudersBrownCorrelation() {
    }

    /**
     * @param capacityFactor Factor de capacidad C [m/s].
     * @param liquidDensity  ρ_L [kg/m³], mayor que ρ_V.
     * @param vaporDensity   ρ_V [kg/m³].
     * @return Velocidad de inundación [m/s].
     */
    public static double floodingVelocity(double capacityFactor, double liquidDensity, double vaporDensity) {
        if (!(vaporDensity > 0) || !(liquidDensity > vaporDensity)) {
            throw new IllegalArgumentException(String.format(
                    "Souders-Brown requiere 0 < rho_V < rho_L (rho_V=%.4f, rho_L=%.4f).", vaporDensity, liquidDensity));
        }
        return capacityFactor * Math.sqrt((liquidDensity - vaporDensity) / vaporDensity);
    }
}
