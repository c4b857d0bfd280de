package in.cep.domain.common;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a credit protocol operation.
 */
public class CreditException extends RuntimeException {

    private final CreditErrorCode code;

    public CreditException(CreditErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CreditException(CreditErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static CreditException invalidRequest(String message) {
        return new CreditException(CreditErrorCode.INVALID_REQUEST, message);
    }

    public static CreditException notFound(String message) {
        return new CreditException(CreditErrorCode.NOT_FOUND, message);
    }

    public static CreditException conflict(String message) {
        return new CreditException(CreditErrorCode.CONFLICT, message);
    }

    public static CreditException dependencyUnavailable(String message) {
        return new CreditException(CreditErrorCode.DEPENDENCY_UNAVAILABLE, message);
    }

    public static CreditException internal(String message, Throwable cause) {
        return new CreditException(CreditErrorCode.INTERNAL, message, cause);
    }

    public CreditErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    /**
     * Recover the CreditException behind a failed future, or null if the failure was something else.
     */
    public static CreditException unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current instanceof CreditException ? (CreditException) current : null;
    }

    @Override
    public String toString() {
        return "CreditException[" + code.wireCode() + "]: " + getMessage();
    }
}
