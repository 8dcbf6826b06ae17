package columndesigner.domain.exception;

/**
 * El vector de composición no es normalizable (suma &lt;= 0 o entradas negativas/no finitas).
 */
public class InvalidCompositionException extends ColumnDesignException {

    public InvalidCompositionException(String message) {
        super(message);
    }
}
