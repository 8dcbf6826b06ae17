package columndesigner.physics.solver;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.design.FeedStageResult;
import columndesigner.domain.design.FugResult;
import columndesigner.domain.exception.FeedStageOutOfBoundsException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.correlation.MolokanovGillilandCorrelation;
import columndesigner.physics.correlation.OConnellEfficiencyCorrelation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedStageLocatorTest {

    @Test
    @DisplayName("Caso de referencia: plato de alimentación 28 de 40")
    void locate_referenceCase() {
        // ARRANGE
        ColumnDesignConfig config = ColumnDesignConfig.getReferenceCase();
        double[] alpha = config.relativeVolatilities();
        double[] z = CompositionNormalizer.normalize(config.feed().composition());
        SeparationSpec spec = SeparationSpecifier.specify(1000.0, z, alpha, config.separation());
        FugResult fug = new FugSolver(new MolokanovGillilandCorrelation()).solve(spec, alpha, 0.8, 1.3);
        EfficiencyResult efficiency = new EfficiencyEstimator(new OConnellEfficiencyCorrelation())
                .estimate(z, new double[]{0.224, 0.295, 0.389, 0.665, 0.85}, alpha, 2, 3, fug.theoreticalStages());

        // ACT
        FeedStageResult result = FeedStageLocator.locate(spec, fug, efficiency);

        // ASSERT
        assertEquals(1.9326703190544015, result.kirkbrideRatio(), 1e-9);
        assertEquals(6.783900378544276, result.minimumRectifyingStages(), 1e-6);
        assertEquals(fug.minimumStages(), result.minimumRectifyingStages() + result.minimumStrippingStages(), 1e-9);
        assertEquals(efficiency.realStages(), result.rectifyingStages() + result.strippingStages(), 1e-9);
        assertEquals(14.360577157334285, result.theoreticalFeedStage(), 1e-5);
        assertEquals(27.805589175920282, result.realFeedStage(), 1e-5);
        assertEquals(28, result.adoptedFeedTray());
    }

    @Test
    @DisplayName("Un plato de alimentación por debajo del fondo de la columna se rechaza")
    void locate_rejectsFeedTrayBeyondColumn() {
        // B/D = 9 y xB_LK/xD_HK = 20: casi todas las etapas en rectificación
        SeparationSpec spec = SeparationSpec.builder()
                .feedFlow(1000.0)
                .feedComposition(new double[]{0.5, 0.5})
                .feedFlows(new double[]{500.0, 500.0})
                .distillateFlow(100.0)
                .bottomsFlow(900.0)
                .distillateFlows(new double[]{99.5, 0.5})
                .bottomsFlows(new double[]{400.5, 499.5})
                .distillateComposition(new double[]{0.995, 0.005})
                .bottomsComposition(new double[]{0.1, 0.9})
                .distillateRecoveries(new double[]{0.199, 0.001})
                .lightKeyIndex(0)
                .heavyKeyIndex(1)
                .build();
        FugResult fug = FugResult.builder().minimumStages(3.0).theoreticalStages(5.0).build();
        EfficiencyResult efficiency = EfficiencyResult.builder()
                .overallEfficiency(1.0).theoreticalStages(5.0).realStages(5.0).adoptedTrays(5).build();

        assertThrows(FeedStageOutOfBoundsException.class, () -> FeedStageLocator.locate(spec, fug, efficiency));
    }
}
