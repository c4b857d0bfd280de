package in.cep.domain.credit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * An agent's declared willingness to spend. Immutable once stored.
 */
public record Intent(
    String intentId,
    String idempotencyKey,
    String agentId,
    ScopeType scopeType,
    String scopeId,
    long maxSats,
    Instant exp,
    JsonNode policyContext,
    Instant createdAt
) {}
