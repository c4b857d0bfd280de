package in.cep.domain.credit;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Credit terms computed for an agent. {@code auditInputs} is the snapshot persisted with the offer.
 */
public record UnderwritingDecision(
    long limitSats,
    int feeBps,
    boolean requiresVerifier,
    double riskScore,
    UnderwritingStats stats,
    JsonNode auditInputs
) {}
