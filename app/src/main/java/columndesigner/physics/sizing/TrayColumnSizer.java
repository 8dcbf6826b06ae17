package columndesigner.physics.sizing;

import columndesigner.config.TrayDesignConditions;
import columndesigner.domain.design.SectionSizing;
import columndesigner.domain.design.TrayColumnSizing;
import columndesigner.domain.exception.InvalidSizingInputException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.correlation.SoudersBrownCorrelation;
import columndesigner.physics.solver.VaporPhaseProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Dimensiona una columna de platos válvula (diámetro y altura).
 * <p>
 * Los caudales internos se obtienen con la hipótesis de caudal molar constante:
 * <pre>
 *   L_R = RR·D          V_R = (RR + 1)·D
 *   L_S = L_R + q·F     V_S = V_R - (1 - q)·F
 * </pre>
 * Cada sección se dimensiona con el límite de inundación de Souders-Brown y el diámetro de la
 * columna es el de la sección más exigente, ya que una única carcasa debe alojar ambas.
 */
@Slf4j
public class TrayColumnSizer {

    public static final String RECTIFYING = "rectificacion";
    public static final String STRIPPING = "agotamiento";

    /**
     * @param spec             Especificación de la separación (D, xD, xB).
     * @param refluxRatio      RR de operación.
     * @param adoptedTrays     Número de platos reales adoptado.
     * @param liquidFraction   Condición térmica q de la alimentación.
     * @param pressureAtm      Presión de operación [atm].
     * @param molecularWeights Masas molares de los componentes [kg/kmol].
     * @param conditions       Hipótesis de diseño de platos.
     */
    public TrayColumnSizing size(SeparationSpec spec, double refluxRatio, int adoptedTrays, double liquidFraction,
                                 double pressureAtm, double[] molecularWeights, TrayDesignConditions conditions) {
        Objects.requireNonNull(spec, "La especificación no puede ser nula.");
        Objects.requireNonNull(conditions, "Las condiciones de platos no pueden ser nulas.");
        validate(refluxRatio, adoptedTrays, pressureAtm, conditions);

        double d = spec.distillateFlow();
        double f = spec.feedFlow();

        double lRect = refluxRatio * d;
        double vRect = (refluxRatio + 1.0) * d;
        double lStrip = lRect + liquidFraction * f;
        double vStrip = vRect - (1.0 - liquidFraction) * f;

        if (!(vStrip > 0) || !(lStrip > 0)) {
            throw new InvalidSizingInputException(String.format(
                    "Caudales de agotamiento no positivos (L_S=%.3f, V_S=%.3f kmol/h): q=%.3f incompatible con RR=%.3f.",
                    lStrip, vStrip, liquidFraction, refluxRatio));
        }

        SectionSizing top = sizeSection(RECTIFYING, lRect, vRect, spec.distillateComposition(), molecularWeights,
                pressureAtm, conditions.topTemperatureK(), conditions.topLiquidDensity(), conditions);
        SectionSizing bottom = sizeSection(STRIPPING, lStrip, vStrip, spec.bottomsComposition(), molecularWeights,
                pressureAtm, conditions.bottomTemperatureK(), conditions.bottomLiquidDensity(), conditions);

        double diameter = Math.max(top.diameter(), bottom.diameter());
        double activeHeight = adoptedTrays * conditions.traySpacing();
        double totalHeight = activeHeight + conditions.extraHeight();

        log.debug("Platos: D_rect={} m, D_agot={} m, H_total={} m", top.diameter(), bottom.diameter(), totalHeight);

        return TrayColumnSizing.builder()
                .adoptedTrays(adoptedTrays)
                .activeHeight(activeHeight)
                .totalHeight(totalHeight)
                .diameter(diameter)
                .rectifying(top)
                .stripping(bottom)
                .build();
    }

    SectionSizing sizeSection(String name, double liquidFlow, double vaporFlow, double[] vaporComposition,
                              double[] molecularWeights, double pressureAtm, double temperatureK,
                              double liquidDensity, TrayDesignConditions conditions) {
        double mwVap = VaporPhaseProperties.averageMolecularWeight(vaporComposition, molecularWeights);
        double rhoVap = VaporPhaseProperties.idealGasDensity(pressureAtm, mwVap, temperatureK);
        if (!(liquidDensity > rhoVap)) {
            throw new InvalidSizingInputException(String.format(
                    "Sección %s: la densidad del líquido (%.2f) debe superar a la del vapor (%.2f kg/m3).", name, liquidDensity, rhoVap));
        }

        double uFlood = SoudersBrownCorrelation.floodingVelocity(conditions.capacityFactor(), liquidDensity, rhoVap);
        double uOp = conditions.floodFraction() * uFlood;

        double massFlowKgS = vaporFlow * mwVap / 3600.0;
        double volumetricFlow = massFlowKgS / rhoVap; // m³/s

        double activeArea = volumetricFlow / uOp;
        double totalArea = activeArea / conditions.activeAreaFraction();
        double diameter = Math.sqrt(4.0 * totalArea / Math.PI);

        return SectionSizing.builder()
                .sectionName(name)
                .liquidFlow(liquidFlow)
                .vaporFlow(vaporFlow)
                .vaporMolecularWeight(mwVap)
                .vaporDensity(rhoVap)
                .liquidDensity(liquidDensity)
                .floodingVelocity(uFlood)
                .operatingVelocity(uOp)
                .activeArea(activeArea)
                .totalArea(totalArea)
                .diameter(diameter)
                .build();
    }

    private static void validate(double refluxRatio, int adoptedTrays, double pressureAtm, TrayDesignConditions c) {
        requirePositive("RR", refluxRatio);
        requirePositive("P", pressureAtm);
        requirePositive("T_cabeza", c.topTemperatureK());
        requirePositive("T_fondo", c.bottomTemperatureK());
        requirePositive("rho_L_cabeza", c.topLiquidDensity());
        requirePositive("rho_L_fondo", c.bottomLiquidDensity());
        requirePositive("C", c.capacityFactor());
        requirePositive("espaciado", c.traySpacing());
        if (adoptedTrays < 1) {
            throw new InvalidSizingInputException("El número de platos debe ser >= 1 (recibido " + adoptedTrays + ").");
        }
        if (!(c.floodFraction() > 0 && c.floodFraction() < 1)) {
            throw new InvalidSizingInputException("La fracción de inundación debe estar en (0, 1) (recibido " + c.floodFraction() + ").");
        }
        if (!(c.activeAreaFraction() > 0 && c.activeAreaFraction() <= 1)) {
            throw new InvalidSizingInputException("La fracción de área activa debe estar en (0, 1] (recibido " + c.activeAreaFraction() + ").");
        }
        if (!(c.extraHeight() >= 0)) {
            throw new InvalidSizingInputException("Las holguras de altura no pueden ser negativas (recibido " + c.extraHeight() + ").");
        }
    }

    static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidSizingInputException(name + " debe ser positivo y finito (recibido " + value + ").");
        }
    }
}
