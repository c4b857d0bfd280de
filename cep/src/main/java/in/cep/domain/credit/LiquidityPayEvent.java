package in.cep.domain.credit;

import java.time.Instant;

/**
 * One Lightning payment attempt made while settling an envelope.
 */
public record LiquidityPayEvent(
    String quoteId,
    String envelopeId,
    String status,
    String errorCode,
    long amountMsats,
    String host,
    Instant createdAt
) {
    public static final String STATUS_SUCCEEDED = "succeeded";

    public boolean succeeded() {
        return STATUS_SUCCEEDED.equals(status);
    }
}
