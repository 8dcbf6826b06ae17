package columndesigner.physics.solver;

import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.exception.EfficiencyOutOfRangeException;
import columndesigner.physics.i.IEfficiencyCorrelation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Convierte etapas teóricas en platos reales mediante una eficiencia global de plato.
 * <p>
 * La viscosidad de la alimentación se estima como media molar de las viscosidades de los
 * componentes puros. La eficiencia no se recorta: un valor fuera de (0, 1] indica que las
 * entradas están fuera del rango validado de la correlación y se informa como error.
 */
@Slf4j
public class EfficiencyEstimator {

    @Getter
    private final IEfficiencyCorrelation correlation;

    public EfficiencyEstimator(IEfficiencyCorrelation correlation) {
        this.correlation = Objects.requireNonNull(correlation, "La correlación de eficiencia no puede ser nula.");
    }

    /**
     * μ_F = Σ z_i · μ_i.
     */
    public static double estimateFeedViscosity(double[] feedComposition, double[] componentViscositiesCp) {
        if (feedComposition.length != componentViscositiesCp.length) {
            throw new IllegalArgumentException("Composición y viscosidades deben tener la misma longitud.");
        }
        double mu = 0.0;
        for (int i = 0; i < feedComposition.length; i++) {
            mu += feedComposition[i] * componentViscositiesCp[i];
        }
        return mu;
    }

    /**
     * @param feedComposition        Composición normalizada de la alimentación.
     * @param componentViscositiesCp Viscosidades de los componentes [cP].
     * @param alpha                  Volatilidades relativas.
     * @param lightKey               Índice del LK.
     * @param heavyKey               Índice del HK.
     * @param theoreticalStages      N_teo de Gilliland.
     */
    public EfficiencyResult estimate(double[] feedComposition, double[] componentViscositiesCp, double[] alpha,
                                     int lightKey, int heavyKey, double theoreticalStages) {
        double mu = estimateFeedViscosity(feedComposition, componentViscositiesCp);
        double alphaRel = alpha[lightKey] / alpha[heavyKey];
        double eta = correlation.overallEfficiency(alphaRel, mu);

        if (!(eta > 0.0 && eta <= 1.0)) {
            throw new EfficiencyOutOfRangeException(String.format(
                    "%s devuelve eta_G=%.4f fuera de (0, 1] para alpha=%.4f y mu_F=%.4f cP.",
                    correlation.getName(), eta, alphaRel, mu));
        }
        log.debug("Eficiencia {}: mu_F={} cP, alpha_rel={}, eta_G={}", correlation.getName(), mu, alphaRel, eta);

        EfficiencyResult base = EfficiencyResult.builder()
                .feedViscosityCp(mu)
                .keyRelativeVolatility(alphaRel)
                .overallEfficiency(eta)
                .build();
        return withTheoreticalStages(base, theoreticalStages);
    }

    /**
     * Reaplica la eficiencia (que sólo depende de la alimentación) a otro número de etapas teóricas.
     */
    public EfficiencyResult withTheoreticalStages(EfficiencyResult efficiency, double theoreticalStages) {
        double realStages = theoreticalStages / efficiency.overallEfficiency();
        return efficiency
                .withTheoreticalStages(theoreticalStages)
                .withRealStages(realStages)
                .withAdoptedTrays((int) Math.ceil(realStages));
    }
}
