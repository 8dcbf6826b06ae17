package columndesigner.physics.correlation;

import columndesigner.physics.i.IGillilandCorrelation;

/**
 * Ajuste de potencia de Eduljee (1975) de la curva de Gilliland.
 * Es finito en reflujo mínimo (Y = 0.75), por lo que X se acota lejos de los extremos.
 */
public class EduljeeGillilandCorrelation implements IGillilandCorrelation {

    private static final double MIN_X = 1e-6;
    private static final double MAX_X = 0.999999;

    @Override
    public String getName() {
        return "Eduljee";
    }

    @Override
    public String getDescription() {
        return "Y = 0.75 * (1 - X^0.5668)";
    }

    @Override
    public double stageFraction(double x) {
        double bounded = Math.max(MIN_X, Math.min(MAX_X, x));
        return 0.75 * (1.0 - Math.pow(bounded, 0.5668));
    }
}
