package columndesigner.physics.solver;

import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.design.FeedStageResult;
import columndesigner.domain.design.FugResult;
import columndesigner.domain.exception.FeedStageOutOfBoundsException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.correlation.KirkbrideCorrelation;
import lombok.extern.slf4j.Slf4j;

/**
 * Localiza el plato de alimentación con la correlación de Kirkbride.
 * <p>
 * El cociente N_R/N_S se aplica a N_min, a N_teo y a N_real. El plato de alimentación es el
 * primero de la sección de agotamiento, contado desde cabeza (j = N_R + 1), y se proyecta
 * sobre la columna real en proporción N_real / N_teo.
 */
@Slf4j
public final class FeedStageLocator {

    private FeedStageLocator() {
    }

    public static FeedStageResult locate(SeparationSpec spec, FugResult fug, EfficiencyResult efficiency) {
        int lk = spec.lightKeyIndex();
        int hk = spec.heavyKeyIndex();

        double ratio = KirkbrideCorrelation.stageRatio(
                spec.bottomsFlow(), spec.distillateFlow(),
                spec.feedFractionOf(hk), spec.feedFractionOf(lk),
                spec.bottomsFractionOf(lk), spec.distillateFractionOf(hk));
        double rectifyingShare = ratio / (1.0 + ratio);

        double nrMin = fug.minimumStages() * rectifyingShare;
        double nsMin = fug.minimumStages() - nrMin;

        double nrOp = efficiency.realStages() * rectifyingShare;
        double nsOp = efficiency.realStages() - nrOp;

        double feedTeo = fug.theoreticalStages() * rectifyingShare + 1.0;
        double feedReal = feedTeo * efficiency.realStages() / fug.theoreticalStages();
        int feedTray = (int) Math.ceil(feedReal);

        if (feedTray < 1 || feedTray > efficiency.adoptedTrays()) {
            throw new FeedStageOutOfBoundsException(String.format(
                    "Plato de alimentación %d fuera de [1, %d] (j_real=%.3f, N_R/N_S=%.4f).",
                    feedTray, efficiency.adoptedTrays(), feedReal, ratio));
        }
        log.debug("Kirkbride: N_R/N_S={}, j_teo={}, j_real={}", ratio, feedTeo, feedReal);

        return FeedStageResult.builder()
                .kirkbrideRatio(ratio)
                .minimumRectifyingStages(nrMin)
                .minimumStrippingStages(nsMin)
                .rectifyingStages(nrOp)
                .strippingStages(nsOp)
                .theoreticalFeedStage(feedTeo)
                .realFeedStage(feedReal)
                .adoptedFeedTray(feedTray)
                .build();
    }
}
