package columndesigner.physics.solver;

import columndesigner.domain.exception.RootNotFoundException;

/**
 * Resuelve la primera ecuación de Underwood por bisección:
 * <pre>
 *   Σ α_i·z_i / (α_i - θ) = 1 - q,   α_HK &lt; θ &lt; α_LK
 * </pre>
 * El lado izquierdo es estrictamente creciente en θ entre dos polos consecutivos, por lo que
 * con claves adyacentes el intervalo contiene una única raíz.
 */
public final class UnderwoodRootSolver {

    private static final int MAX_ITERATIONS = 200;
    private static final double TOLERANCE = 1e-10;
    // Separación relativa de los polos para no evaluar en α_HK ni en α_LK
    private static final double POLE_OFFSET = 1e-9;

    private UnderwoodRootSolver() {
    }

    /**
     * Encuentra θ. Esta clase es Thread safe.
     *
     * @param alpha        Volatilidades relativas.
     * @param feedFraction Composición z de la alimentación.
     * @param liquidFraction Condición térmica q.
     * @param lightKey     Índice del LK.
     * @param heavyKey     Índice del HK.
     * @return θ estrictamente entre α[HK] y α[LK].
     * @throws RootNotFoundException si α no es estrictamente decreciente, no hay cambio de signo en el
     *                               intervalo o la bisección no converge.
     */
    public static double solveTheta(double[] alpha, double[] feedFraction, double liquidFraction,
                                    int lightKey, int heavyKey) {
        requireStrictlyDecreasing(alpha);

        double alphaHk = alpha[heavyKey];
        double alphaLk = alpha[lightKey];
        double width = alphaLk - alphaHk;
        if (!(width > 0)) {
            throw new RootNotFoundException(String.format(
                    "Underwood: intervalo vacío (α_HK=%.4f, α_LK=%.4f). Revise el orden de α.", alphaHk, alphaLk));
        }

        double lo = alphaHk + POLE_OFFSET * width;
        double hi = alphaLk - POLE_OFFSET * width;
        double fLo = balance(lo, alpha, feedFraction, liquidFraction);
        double fHi = balance(hi, alpha, feedFraction, liquidFraction);

        if (!Double.isFinite(fLo) || !Double.isFinite(fHi) || fLo * fHi > 0) {
            throw new RootNotFoundException(String.format(
                    "Underwood: no hay cambio de signo en (%.4f, %.4f). Verifique α, z, q y los índices LK/HK.", alphaHk, alphaLk));
        }

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double mid = 0.5 * (lo + hi);
            double fMid = balance(mid, alpha, feedFraction, liquidFraction);
            if (Math.abs(fMid) < TOLERANCE || (hi - lo) < TOLERANCE * width) {
                return mid;
            }
            if (fLo * fMid < 0) {
                hi = mid;
            } else {
                lo = mid;
                fLo = fMid;
            }
        }
        throw new RootNotFoundException("Underwood: la bisección no convergió en " + MAX_ITERATIONS + " iteraciones.");
    }

    /**
     * Con α desordenado otro polo puede caer dentro de (α_HK, α_LK) y la raíz deja de ser única.
     */
    private static void requireStrictlyDecreasing(double[] alpha) {
        for (int i = 1; i < alpha.length; i++) {
            if (!(alpha[i - 1] > alpha[i])) {
                throw new RootNotFoundException(String.format(
                        "Underwood: α debe ser estrictamente decreciente (α[%d]=%.4f, α[%d]=%.4f).",
                        i - 1, alpha[i - 1], i, alpha[i]));
            }
        }
    }

    /**
     * Segunda ecuación de Underwood: RR_min = Σ α_i·xD_i / (α_i - θ) - 1.
     */
    public static double minimumReflux(double[] alpha, double[] distillateFraction, double theta) {
        double sum = 0.0;
        for (int i = 0; i < alpha.length; i++) {
            sum += alpha[i] * distillateFraction[i] / (alpha[i] - theta);
        }
        return sum - 1.0;
    }

    /**
     * f(θ) = Σ α_i·z_i / (α_i - θ) - (1 - q).
     */
    static double balance(double theta, double[] alpha, double[] feedFraction, double liquidFraction) {
        double sum = 0.0;
        for (int i = 0; i < alpha.length; i++) {
            sum += alpha[i] * feedFraction[i] / (alpha[i] - theta);
        }
        return sum - (1.0 - liquidFraction);
    }
}
