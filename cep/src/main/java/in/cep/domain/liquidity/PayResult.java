package in.cep.domain.liquidity;

/**
 * Outcome of paying a quote. {@code receiptSha256} is the liquidity service's own receipt digest.
 */
public record PayResult(
    String quoteId,
    String status,
    String receiptSha256,
    String errorCode
) {
    public static final String SUCCEEDED = "succeeded";

    public boolean succeeded() {
        return SUCCEEDED.equals(status);
    }
}
