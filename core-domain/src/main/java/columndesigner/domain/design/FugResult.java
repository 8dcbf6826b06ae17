package columndesigner.domain.design;

import lombok.Builder;
import lombok.With;

/**
 * Resultado del método abreviado Fenske-Underwood-Gilliland.
 * <p>
 * Los mínimos (N_min, RR_min, θ) no dependen del reflujo de operación; el barrido de
 * sensibilidad reutiliza estos valores y sólo repite el paso de Gilliland.
 *
 * @param minimumStages          N_min de Fenske (reflujo total), &gt;= 0.
 * @param minimumRefluxRatio     RR_min de Underwood.
 * @param underwoodRoot          Raíz θ de Underwood, estrictamente entre α[HK] y α[LK].
 * @param refluxFactor           Factor f_R aplicado sobre el mínimo.
 * @param operatingRefluxRatio   RR de operación = f_R · RR_min.
 * @param gillilandAbscissa      X = (RR - RR_min) / (RR + 1).
 * @param gillilandOrdinate      Y(X) = (N - N_min) / (N + 1).
 * @param theoreticalStages      N_teo corregido por Gilliland, sin redondear, &gt;= N_min.
 */
@Builder
@With
public record FugResult(
        double minimumStages,
        double minimumRefluxRatio,
        double underwoodRoot,
        double refluxFactor,
        double operatingRefluxRatio,
        double gillilandAbscissa,
        double gillilandOrdinate,
        double theoreticalStages
) {
}
