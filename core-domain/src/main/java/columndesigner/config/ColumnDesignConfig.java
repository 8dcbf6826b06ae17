package columndesigner.config;

import columndesigner.domain.separation.SeparationTarget;
import lombok.Builder;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Contenedor principal para todas las configuraciones de un diseño de columna.
 * Agrupa las condiciones de alimentación, la especificación de la separación, el reflujo
 * de operación, el barrido de sensibilidad y las hipótesis físicas de los dos modelos de
 * dimensionamiento (platos y relleno).
 *
 * @param feed                   Condiciones de la alimentación.
 * @param relativeVolatilities   Vector α alineado por índice con la tabla de componentes (más volátil primero).
 * @param separation             Objetivos de recuperación y componentes clave.
 * @param refluxFactor           Factor de reflujo de operación f_R = RR / RR_min (> 1).
 * @param sweepRefluxFactors     Factores de reflujo del análisis de sensibilidad, en el orden del informe.
 * @param gillilandForm          Ajuste publicado de la correlación de Gilliland a utilizar.
 * @param tray                   Hipótesis del dimensionamiento de la columna de platos.
 * @param packing                Hipótesis del dimensionamiento de la columna de relleno.
 * @param sweepParallelism       Número de hilos para el barrido de reflujo (1 = secuencial).
 */
@Builder
@With
public record ColumnDesignConfig(
        FeedConditions feed,
        double[] relativeVolatilities,
        SeparationTarget separation,
        double refluxFactor,
        List<Double> sweepRefluxFactors,
        GillilandForm gillilandForm,
        TrayDesignConditions tray,
        PackingDesignConditions packing,
        int sweepParallelism
) {
    public ColumnDesignConfig {
        Objects.requireNonNull(feed, "Las condiciones de alimentación no pueden ser nulas.");
        Objects.requireNonNull(relativeVolatilities, "El vector de volatilidades no puede ser nulo.");
        Objects.requireNonNull(separation, "La especificación de separación no puede ser nula.");
        Objects.requireNonNull(tray, "Las condiciones de platos no pueden ser nulas.");
        Objects.requireNonNull(packing, "Las condiciones de relleno no pueden ser nulas.");
        relativeVolatilities = relativeVolatilities.clone();
        sweepRefluxFactors = sweepRefluxFactors == null ? List.of() : List.copyOf(sweepRefluxFactors);
        gillilandForm = gillilandForm == null ? GillilandForm.MOLOKANOV : gillilandForm;
        sweepParallelism = Math.max(sweepParallelism, 1);
    }

    @Override
    public double[] relativeVolatilities() {
        return relativeVolatilities.clone();
    }

    /**
     * Ajustes publicados de la correlación de Gilliland.
     */
    public enum GillilandForm {
        /** Molokanov et al. (1972). Cumple ambos límites: N → ∞ en RR_min y N → N_min en reflujo total. */
        MOLOKANOV,
        /** Eduljee (1975). Ajuste de potencia, finito en RR_min. */
        EDULJEE
    }

    /**
     * Caso de referencia: separación n-C5/n-C6/n-C7/n-C9/n-C10 con n-C7 como clave ligero
     * y n-C9 como clave pesado.
     */
    public static ColumnDesignConfig getReferenceCase() {
        return ColumnDesignConfig.builder()
                .feed(FeedConditions.builder()
                        .feedFlow(1000.0)
                        .composition(new double[]{0.05, 0.10, 0.25, 0.30, 0.30})
                        .vaporFraction(0.20)
                        .pressureAtm(2.0)
                        .build())
                .relativeVolatilities(new double[]{3.0, 2.3, 1.8, 1.3, 1.0})
                .separation(SeparationTarget.builder()
                        .lightKeyIndex(2)
                        .heavyKeyIndex(3)
                        .lightKeyRecovery(0.60)
                        .heavyKeyRecovery(0.05)
                        .distillateRecoveries(new double[]{0.999, 0.995, 0.60, 0.05, 0.001})
                        .build())
                .refluxFactor(1.30)
                .sweepRefluxFactors(List.of(1.1, 1.2, 1.3, 1.5, 2.0))
                .gillilandForm(GillilandForm.MOLOKANOV)
                .tray(TrayDesignConditions.getValveTrayDefaults())
                .packing(PackingDesignConditions.getIntaloxSaddlesDefaults())
                .sweepParallelism(1)
                .build();
    }
}
