package columndesigner.domain.design;

import lombok.Builder;

/**
 * Dimensionamiento hidráulico de una sección (rectificación o agotamiento) de la columna de platos.
 *
 * @param sectionName           "rectificacion" o "agotamiento".
 * @param liquidFlow            L [kmol/h].
 * @param vaporFlow             V [kmol/h].
 * @param vaporMolecularWeight  Masa molar media del vapor [kg/kmol].
 * @param vaporDensity          Densidad del vapor (gas ideal) [kg/m³].
 * @param liquidDensity         Densidad del líquido asumida [kg/m³].
 * @param floodingVelocity      Velocidad de inundación de Souders-Brown [m/s].
 * @param operatingVelocity     Velocidad de operación [m/s], siempre menor que la de inundación.
 * @param activeArea            Área activa necesaria [m²].
 * @param totalArea             Área transversal total [m²].
 * @param diameter              Diámetro de la sección [m].
 */
@Builder
public record SectionSizing(
        String sectionName,
        double liquidFlow,
        double vaporFlow,
        double vaporMolecularWeight,
        double vaporDensity,
        double liquidDensity,
        double floodingVelocity,
        double operatingVelocity,
        double activeArea,
        double totalArea,
        double diameter
) {
}
