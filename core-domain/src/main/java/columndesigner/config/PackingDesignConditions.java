package columndesigner.config;

import lombok.Builder;
import lombok.With;

/**
 * Hipótesis físicas para el dimensionamiento de la columna de relleno aleatorio.
 * Los valores por defecto corresponden a sillas Intalox de 1".
 *
 * @param packingName       Descripción del relleno (informativa).
 * @param topTemperatureK   Temperatura en cabeza [K].
 * @param liquidDensity     Densidad del líquido [kg/m³].
 * @param liquidViscosityCp Viscosidad del líquido [cP].
 * @param floodFraction     Fracción φ de la velocidad de inundación de operación (0, 1).
 * @param packingFactor     Factor de relleno Fp [ft⁻¹].
 * @param hetpFt            Altura equivalente a un plato teórico [ft].
 * @param extraHeight       Holguras para distribuidor y soporte de líquido [m].
 */
@Builder
@With
public record PackingDesignConditions(
        String packingName,
        double topTemperatureK,
        double liquidDensity,
        double liquidViscosityCp,
        double floodFraction,
        double packingFactor,
        double hetpFt,
        double extraHeight
) {
    public static PackingDesignConditions getIntaloxSaddlesDefaults() {
        return PackingDesignConditions.builder()
                .packingName("Intalox Saddles 1\"")
                .topTemperatureK(370.0)
                .liquidDensity(630.0)
                .liquidViscosityCp(0.5)
                .floodFraction(0.70)
                .packingFactor(92.0)
                // HETP = 1.5 * Dp[in] para relleno aleatorio con líquidos poco viscosos
                .hetpFt(1.5)
                .extraHeight(2.0)
                .build();
    }
}
