package in.cep.domain.credit;

import java.time.Instant;

/**
 * A drawn credit line for one provider.
 */
public record Envelope(
    String envelopeId,
    String offerId,
    String agentId,
    String poolId,
    String providerId,
    ScopeType scopeType,
    String scopeId,
    long maxSats,
    int feeBps,
    Instant exp,
    EnvelopeStatus status,
    Instant issuedAt
) {
    public Envelope withStatus(EnvelopeStatus newStatus) {
        return new Envelope(envelopeId, offerId, agentId, poolId, providerId, scopeType, scopeId,
            maxSats, feeBps, exp, newStatus, issuedAt);
    }

    /**
     * Open envelopes reserve pool liquidity: accepted and not yet expired.
     */
    public boolean isOpenAt(Instant now) {
        return status == EnvelopeStatus.ACCEPTED && exp.isAfter(now);
    }
}
