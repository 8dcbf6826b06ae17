package columndesigner.domain.design;

import lombok.Builder;
import lombok.With;

/**
 * Corrección de etapas teóricas a platos reales mediante la eficiencia global de O'Connell.
 *
 * @param feedViscosityCp    Viscosidad estimada de la alimentación μ_F [cP].
 * @param keyRelativeVolatility α[LK]/α[HK] (&gt; 1).
 * @param overallEfficiency  Eficiencia global η_G en (0, 1].
 * @param theoreticalStages  N_teo sobre el que se aplica la corrección.
 * @param realStages         N_real = N_teo / η_G.
 * @param adoptedTrays       N_pratos = ceil(N_real).
 */
@Builder
@With
public record EfficiencyResult(
        double feedViscosityCp,
        double keyRelativeVolatility,
        double overallEfficiency,
        double theoreticalStages,
        double realStages,
        int adoptedTrays
) {
}
