package in.cep.domain.common;

/**
 * Error taxonomy returned by every protocol operation.
 */
public enum CreditErrorCode {
    INVALID_REQUEST("invalid_request", false),
    NOT_FOUND("not_found", false),
    CONFLICT("conflict", false),
    DEPENDENCY_UNAVAILABLE("dependency_unavailable", true),
    INTERNAL("internal_error", false);

    private final String wireCode;
    private final boolean retryable;

    CreditErrorCode(String wireCode, boolean retryable) {
        this.wireCode = wireCode;
        this.retryable = retryable;
    }

    public String wireCode() {
        return wireCode;
    }

    /**
     * Only dependency failures (tripped breaker, unreachable payment service) are worth retrying later.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
