package in.cep.domain.credit;

import java.time.Instant;

/**
 * The pool's underwritten willingness to extend credit.
 * maxSats and feeBps are the granted values, never the caller's request.
 */
public record Offer(
    String offerId,
    String agentId,
    String poolId,
    String intentId,           // null when the offer is not bound to an intent
    ScopeType scopeType,
    String scopeId,
    long maxSats,
    int feeBps,
    boolean requiresVerifier,
    Instant exp,
    OfferStatus status,
    Instant issuedAt
) {
    public Offer withStatus(OfferStatus newStatus) {
        return new Offer(offerId, agentId, poolId, intentId, scopeType, scopeId,
            maxSats, feeBps, requiresVerifier, exp, newStatus, issuedAt);
    }
}
