package columndesigner.domain.exception;

/**
 * El plato de alimentación real calculado cae fuera de [1, N_pratos].
 */
public class FeedStageOutOfBoundsException extends ColumnDesignException {

    public FeedStageOutOfBoundsException(String message) {
        super(message);
    }
}
