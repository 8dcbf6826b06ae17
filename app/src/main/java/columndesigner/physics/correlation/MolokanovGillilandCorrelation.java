package columndesigner.physics.correlation;

import columndesigner.physics.i.IGillilandCorrelation;

/**
 * Ajuste de Molokanov et al. (1972) de la curva de Gilliland.
 * <p>
 * Tiende a Y = 1 cuando X → 0 (infinitas etapas en reflujo mínimo) y a Y = 0 cuando
 * X → 1 (N_min en reflujo total).
 */
public class MolokanovGillilandCorrelation implements IGillilandCorrelation {

    @Override
    public String getName() {
        return "Molokanov";
    }

    @Override
    public String getDescription() {
        return "Y = 1 - exp[((1 + 54.4X) / (11 + 117.2X)) * ((X - 1) / sqrt(X))]";
    }

    @Override
    public double stageFraction(double x) {
        if (x <= 0.0) return 1.0;
        if (x >= 1.0) return 0.0;
        double exponent = ((1.0 + 54.4 * x) / (11.0 + 117.2 * x)) * ((x - 1.0) / Math.sqrt(x));
        return 1.0 - Math.exp(exponent);
    }
}
