package in.cep.domain.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Declare an agent's willingness to spend within a scope.
 *
 * @param policyContext optional free-form caller context, folded into the fingerprint
 */
public record IntentRequest(
    String schema,
    String idempotencyKey,
    String agentId,
    String scopeType,
    String scopeId,
    long maxSats,
    Instant exp,
    JsonNode policyContext
) {}
