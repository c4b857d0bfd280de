package in.cep.domain.liquidity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Quote request sent to the liquidity service.
 *
 * @param idempotencyKey payment-side key; identical settle requests produce the same key
 */
public record QuotePayRequest(
    String idempotencyKey,
    String invoice,
    String host,
    long maxAmountMsats,
    long maxFeeMsats,
    JsonNode policyContext
) {}
