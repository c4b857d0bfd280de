package in.cep.domain.protocol;

import java.time.Instant;

/**
 * An agent's open exposure, recent history and the terms underwriting would grant now.
 */
public record AgentExposure(
    String schema,
    String agentId,
    long openEnvelopeCount,
    long openExposureSats,
    int settledCount30d,
    long successVolumeSats30d,
    double passRate30d,
    int lossCount30d,
    double weightedLossScore,
    long underwritingLimitSats,
    int underwritingFeeBps,
    boolean requiresVerifier,
    Instant computedAt
) {}
