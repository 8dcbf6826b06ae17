package columndesigner.domain.design;

import lombok.Builder;

/**
 * Una fila del análisis de sensibilidad al reflujo.
 */
@Builder
public record RefluxSweepRow(
        double refluxFactor,
        double refluxRatio,
        double theoreticalStages,
        double realStages,
        int adoptedTrays,
        double trayColumnDiameter,
        double trayColumnTotalHeight
) {
}
