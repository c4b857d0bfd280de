package in.cep.domain.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reconcile an envelope once the verification result is known.
 * Invoice and host are only required when verification passed.
 */
public record SettleRequest(
    String schema,
    String envelopeId,
    boolean verificationPassed,
    String verificationReceiptSha256,
    String providerInvoice,
    String providerHost,
    long maxFeeMsats,
    JsonNode policyContext
) {}
