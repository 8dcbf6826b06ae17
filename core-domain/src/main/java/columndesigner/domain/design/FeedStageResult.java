package columndesigner.domain.design;

import lombok.Builder;

/**
 * Localización del plato de alimentación (correlación de Kirkbride).
 * Todas las posiciones se cuentan desde la cabeza de la columna.
 *
 * @param kirkbrideRatio          Cociente N_R / N_S de Kirkbride.
 * @param minimumRectifyingStages N_R,min (reparto de N_min).
 * @param minimumStrippingStages  N_S,min.
 * @param rectifyingStages        N_R,op (reparto de N_real).
 * @param strippingStages         N_S,op.
 * @param theoreticalFeedStage    Plato de alimentación teórico j_feed,teo.
 * @param realFeedStage           Proyección sobre la columna real j_feed,real.
 * @param adoptedFeedTray         ceil(j_feed,real), en [1, N_pratos].
 */
@Builder
public record FeedStageResult(
        double kirkbrideRatio,
        double minimumRectifyingStages,
        double minimumStrippingStages,
        double rectifyingStages,
        double strippingStages,
        double theoreticalFeedStage,
        double realFeedStage,
        int adoptedFeedTray
) {
}
