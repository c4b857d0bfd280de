package in.cep.application.port.output;

/**
 * Failure raised by a {@link CreditStore}.
 */
public class CreditStoreException extends RuntimeException {

    public enum Kind {
        CONFLICT,     // same key, different fingerprint or digest
        NOT_FOUND,
        DB            // storage failure
    }

    private final Kind kind;

    public CreditStoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CreditStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CreditStoreException conflict(String message) {
        return new CreditStoreException(Kind.CONFLICT, message);
    }

    public static CreditStoreException notFound(String message) {
        return new CreditStoreException(Kind.NOT_FOUND, message);
    }

    public static CreditStoreException db(String message, Throwable cause) {
        return new CreditStoreException(Kind.DB, message, cause);
    }

    public Kind getKind() {
        return kind;
    }
}
