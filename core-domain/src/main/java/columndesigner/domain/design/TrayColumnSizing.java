package columndesigner.domain.design;

import lombok.Builder;

/**
 * Dimensiones de la columna de platos válvula.
 *
 * @param adoptedTrays    Número de platos adoptado.
 * @param activeHeight    Altura ocupada por los platos [m].
 * @param totalHeight     Altura total con holguras [m].
 * @param diameter        Diámetro adoptado = máximo de las dos secciones [m].
 * @param rectifying      Sección de rectificación (cabeza).
 * @param stripping       Sección de agotamiento (fondo).
 */
@Builder
public record TrayColumnSizing(
        int adoptedTrays,
        double activeHeight,
        double totalHeight,
        double diameter,
        SectionSizing rectifying,
        SectionSizing stripping
) {
}
