package columndesigner.config;

import lombok.Builder;
import lombok.With;

/**
 * Hipótesis físicas para el dimensionamiento de la columna de platos válvula.
 *
 * @param topTemperatureK       Temperatura de la sección de rectificación [K].
 * @param bottomTemperatureK    Temperatura de la sección de agotamiento [K].
 * @param topLiquidDensity      Densidad del líquido asumida en cabeza [kg/m³].
 * @param bottomLiquidDensity   Densidad del líquido asumida en fondo [kg/m³].
 * @param floodFraction         Fracción de la velocidad de inundación a la que se opera (0, 1).
 * @param activeAreaFraction    Fracción de la sección transversal que es área activa (0, 1].
 * @param capacityFactor        Factor de capacidad de Souders-Brown C [m/s].
 * @param traySpacing           Espaciado entre platos [m].
 * @param extraHeight           Holguras de cabeza, fondo y zonas de separación [m].
 */
@Builder
@With
public record TrayDesignConditions(
        double topTemperatureK,
        double bottomTemperatureK,
        double topLiquidDensity,
        double bottomLiquidDensity,
        double floodFraction,
        double activeAreaFraction,
        double capacityFactor,
        double traySpacing,
        double extraHeight
) {
    public static TrayDesignConditions getValveTrayDefaults() {
        return TrayDesignConditions.builder()
                .topTemperatureK(370.0)
                .bottomTemperatureK(430.0)
                .topLiquidDensity(650.0)
                .bottomLiquidDensity(700.0)
                .floodFraction(0.75)
                .activeAreaFraction(0.80)
                .capacityFactor(0.15)
                .traySpacing(0.5)
                .extraHeight(4.0)
                .build();
    }
}
