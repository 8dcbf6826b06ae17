package columndesigner.domain.exception;

/**
 * La correlación de O'Connell devuelve una eficiencia fuera de (0, 1].
 */
public class EfficiencyOutOfRangeException extends ColumnDesignException {

    public EfficiencyOutOfRangeException(String message) {
        super(message);
    }
}
