package columndesigner.physics.sizing;

import columndesigner.config.PackingDesignConditions;
import columndesigner.domain.design.PackedColumnSizing;
import columndesigner.domain.exception.InvalidSizingInputException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.correlation.LevaFloodingCorrelation;
import columndesigner.physics.solver.VaporPhaseProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Dimensiona una columna de relleno aleatorio a partir de las condiciones de cabeza.
 * <p>
 * - Velocidad de inundación por el método de Leva.
 * - Operación a φ·u_flood.
 * - Altura de lecho = N_teo · HETP, más holguras de distribuidor y soporte.
 */
@Slf4j
public class PackedColumnSizer {

    public PackedColumnSizing size(SeparationSpec spec, double refluxRatio, double theoreticalStages,
                                   double pressureAtm, double[] molecularWeights, PackingDesignConditions conditions) {
        Objects.requireNonNull(spec, "La especificación no puede ser nula.");
        Objects.requireNonNull(conditions, "Las condiciones de relleno no pueden ser nulas.");
        validate(refluxRatio, theoreticalStages, pressureAtm, conditions);

        double mwTop = VaporPhaseProperties.averageMolecularWeight(spec.distillateComposition(), molecularWeights);
        double rhoV = VaporPhaseProperties.idealGasDensity(pressureAtm, mwTop, conditions.topTemperatureK());
        double rhoL = conditions.liquidDensity();
        if (!(rhoL > rhoV)) {
            throw new InvalidSizingInputException(String.format(
                    "La densidad del líquido (%.2f) debe superar a la del vapor (%.2f kg/m3).", rhoL, rhoV));
        }

        // L0 y V1 en cabeza; ambas corrientes tienen la composición del destilado
        double d = spec.distillateFlow();
        double liquidMass = refluxRatio * d * mwTop;        // kg/h
        double vaporMass = (refluxRatio + 1.0) * d * mwTop;  // kg/h

        double flowParameter = (liquidMass / vaporMass) * Math.sqrt(rhoV / rhoL);
        if (!LevaFloodingCorrelation.isWithinRange(flowParameter)) {
            throw new InvalidSizingInputException(String.format(
                    "F_LV=%.5f fuera del rango de la correlación de Leva [%.3f, %.1f].", flowParameter,
                    LevaFloodingCorrelation.MIN_FLOW_PARAMETER, LevaFloodingCorrelation.MAX_FLOW_PARAMETER));
        }
        double capacity = LevaFloodingCorrelation.capacityParameter(flowParameter);

        double uFlood;
        try {
            uFlood = LevaFloodingCorrelation.floodingVelocity(capacity, rhoV, rhoL,
                    conditions.liquidViscosityCp(), conditions.packingFactor());
        } catch (IllegalArgumentException e) {
            throw new InvalidSizingInputException(e.getMessage());
        }
        double uOp = conditions.floodFraction() * uFlood;

        double massVelocity = rhoV * uOp;               // kg/(m²·s)
        double area = (vaporMass / 3600.0) / massVelocity;
        double diameter = Math.sqrt(4.0 * area / Math.PI);

        double packedHeight = theoreticalStages * LevaFloodingCorrelation.feetToMeters(conditions.hetpFt());
        double totalHeight = packedHeight + conditions.extraHeight();

        log.debug("Relleno: F_LV={}, Y={}, u_flood={} m/s, D={} m", flowParameter, capacity, uFlood, diameter);

        return PackedColumnSizing.builder()
                .packingName(conditions.packingName())
                .topVaporMolecularWeight(mwTop)
                .vaporDensity(rhoV)
                .liquidDensity(rhoL)
                .flowParameter(flowParameter)
                .capacityParameter(capacity)
                .floodingVelocity(uFlood)
                .operatingVelocity(uOp)
                .crossSectionArea(area)
                .diameter(diameter)
                .packedHeight(packedHeight)
                .totalHeight(totalHeight)
                .build();
    }

    private static void validate(double refluxRatio, double theoreticalStages, double pressureAtm, PackingDesignConditions c) {
        TrayColumnSizer.requirePositive("RR", refluxRatio);
        TrayColumnSizer.requirePositive("N_teo", theoreticalStages);
        TrayColumnSizer.requirePositive("P", pressureAtm);
        TrayColumnSizer.requirePositive("T_cabeza", c.topTemperatureK());
        TrayColumnSizer.requirePositive("rho_L", c.liquidDensity());
        TrayColumnSizer.requirePositive("mu_L", c.liquidViscosityCp());
        TrayColumnSizer.requirePositive("Fp", c.packingFactor());
        TrayColumnSizer.requirePositive("HETP", c.hetpFt());
        if (!(c.floodFraction() > 0 && c.floodFraction() < 1)) {
            throw new InvalidSizingInputException("La fracción de inundación φ debe estar en (0, 1) (recibido " + c.floodFraction() + ").");
        }
        if (!(c.extraHeight() >= 0)) {
            throw new InvalidSizingInputException("Las holguras de altura no pueden ser negativas (recibido " + c.extraHeight() + ").");
        }
    }
}
