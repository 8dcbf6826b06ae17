package columndesigner.domain.exception;

/**
 * Factor de reflujo de operación o de barrido &lt;= 1 (o numéricamente indistinguible del mínimo).
 */
public class InvalidRefluxException extends ColumnDesignException {

    public InvalidRefluxException(String message) {
        super(message);
    }
}
