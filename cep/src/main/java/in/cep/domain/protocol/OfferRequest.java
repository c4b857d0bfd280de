package in.cep.domain.protocol;

import java.time.Instant;

/**
 * Ask the pool to underwrite credit for an agent.
 * maxSats, feeBps and requiresVerifier are what the caller asks for; underwriting decides what is granted.
 */
public record OfferRequest(
    String schema,
    String agentId,
    String poolId,
    String intentId,
    String scopeType,
    String scopeId,
    long maxSats,
    int feeBps,
    boolean requiresVerifier,
    Instant exp
) {}
