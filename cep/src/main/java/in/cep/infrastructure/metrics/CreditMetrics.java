package in.cep.infrastructure.metrics;

import java.time.Duration;

/**
 * Credit engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Operation outcomes and latency per protocol step
 * - Settlement outcomes and settled/fee sats
 * - Issued envelope sats
 * - Circuit breaker state
 * - Lightning payment statuses
 */
public interface CreditMetrics {

    /**
     * Record a completed protocol operation.
     *
     * @param operation intent, offer, envelope, settle, health or agent_exposure
     * @param outcome   "ok" or the wire error code
     * @param latency   wall time of the operation
     */
    void recordOperation(String operation, String outcome, Duration latency);

    void recordEnvelopeIssued(long maxSats);

    void recordSettlement(String outcome, long spentSats, long feeSats);

    void recordPayment(String status);

    void updateBreakers(boolean haltNewEnvelopes, boolean haltLargeSettlements);

    static CreditMetrics noop() {
        return NoopCreditMetrics.INSTANCE;
    }
}
