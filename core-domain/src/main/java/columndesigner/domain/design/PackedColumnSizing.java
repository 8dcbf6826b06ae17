package columndesigner.domain.design;

import lombok.Builder;

/**
 * Dimensiones de la columna de relleno aleatorio (método de Leva).
 *
 * @param packingName              Relleno considerado.
 * @param topVaporMolecularWeight  Masa molar media en cabeza [kg/kmol].
 * @param vaporDensity             Densidad del vapor en cabeza [kg/m³].
 * @param liquidDensity            Densidad del líquido [kg/m³].
 * @param flowParameter            F_LV = (L/V)·√(ρ_V/ρ_L).
 * @param capacityParameter        Parámetro de capacidad Y de la correlación generalizada.
 * @param floodingVelocity         Velocidad superficial de inundación del vapor [m/s].
 * @param operatingVelocity        Velocidad superficial de operación [m/s].
 * @param crossSectionArea         Área transversal [m²].
 * @param diameter                 Diámetro [m].
 * @param packedHeight             Altura de lecho = N_teo · HETP [m].
 * @param totalHeight              Altura total con distribuidor y soporte [m].
 */
@Builder
public record PackedColumnSizing(
        String packingName,
        double topVaporMolecularWeight,
        double vaporDensity,
        double liquidDensity,
        double flowParameter,
        double capacityParameter,
        double floodingVelocity,
        double operatingVelocity,
        double crossSectionArea,
        double diameter,
        double packedHeight,
        double totalHeight
) {
}
