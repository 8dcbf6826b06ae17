package columndesigner.physics.correlation;

import columndesigner.physics.i.IEfficiencyCorrelation;

/**
 * Correlación de O'Connell (1946) para la eficiencia global de columnas de fraccionamiento,
 * en la forma regresionada de Lockett: η_G = 0.492 · (α·μ)^-0.245.
 * Decrece monótonamente con la volatilidad relativa y con la viscosidad.
 */
public class OConnellEfficiencyCorrelation implements IEfficiencyCorrelation {

    private static final double COEFFICIENT = 0.492;
    private static final double EXPONENT = -0.245;

    @Override
    public String getName() {
        return "O'Connell";
    }

    @Override
    public String getDescription() {
        return "eta_G = 0.492 * (alpha * mu_F[cP])^-0.245";
    }

    @Override
    public double overallEfficiency(double keyRelativeVolatility, double feedViscosityCp) {
        double alphaMu = keyRelativeVolatility * feedViscosityCp;
        if (!(alphaMu > 0)) {
            throw new IllegalArgumentException("alpha * mu_F debe ser > 0 (recibido " + alphaMu + ").");
        }
        return COEFFICIENT * Math.pow(alphaMu, EXPONENT);
    }
}
