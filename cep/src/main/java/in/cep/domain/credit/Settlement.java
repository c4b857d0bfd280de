package in.cep.domain.credit;

import java.time.Instant;

/**
 * Final reconciliation of an envelope. At most one exists per envelope.
 */
public record Settlement(
    String settlementId,
    String envelopeId,
    String agentId,
    String poolId,
    String providerId,
    SettlementOutcome outcome,
    long spentSats,
    long feeSats,
    boolean verificationPassed,
    String verificationReceiptSha256,
    String liquidityReceiptSha256,    // null unless a payment succeeded
    Instant createdAt
) {}
