package columndesigner.factory;

import columndesigner.config.ColumnDesignConfig.GillilandForm;
import columndesigner.physics.correlation.EduljeeGillilandCorrelation;
import columndesigner.physics.correlation.MolokanovGillilandCorrelation;
import columndesigner.physics.correlation.OConnellEfficiencyCorrelation;
import columndesigner.physics.i.IEfficiencyCorrelation;
import columndesigner.physics.i.IGillilandCorrelation;

/**
 * Traduce las opciones de configuración a implementaciones de correlaciones.
 * Desacopla la capa de configuración de la capa física.
 */
public final class CorrelationFactory {

    private CorrelationFactory() {
    }

    public static IGillilandCorrelation gilliland(GillilandForm form) {
        if (form == null) return new MolokanovGillilandCorrelation();

        switch (form) {
            case EDULJEE:   return new EduljeeGillilandCorrelation();
            case MOLOKANOV:
            default:        return new MolokanovGillilandCorrelation();
        }
    }

    public static IEfficiencyCorrelation efficiency() {
        return new OConnellEfficiencyCorrelation();
    }
}
