package in.cep.domain.credit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Hash-addressed, optionally signed record of a state transition.
 * The digest covers the canonical form of {@code payload}.
 */
public record CreditReceipt(
    String receiptId,
    String schema,
    String canonicalJsonSha256,
    ReceiptSignature signature,     // null when no signing key is configured
    JsonNode payload,
    Instant createdAt
) {
    public boolean isSigned() {
        return signature != null;
    }
}
