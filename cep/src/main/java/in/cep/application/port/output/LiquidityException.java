package in.cep.application.port.output;

/**
 * Failure raised by {@link LiquidityPayments} before a payment status is known.
 */
public class LiquidityException extends RuntimeException {

    public enum Kind {
        INVALID_REQUEST,
        NOT_FOUND,
        CONFLICT,
        DEPENDENCY_UNAVAILABLE,
        INTERNAL
    }

    private final Kind kind;

    public LiquidityException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LiquidityException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
