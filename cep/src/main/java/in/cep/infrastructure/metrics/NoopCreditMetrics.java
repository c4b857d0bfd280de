package in.cep.infrastructure.metrics;

import java.time.Duration;

final class NoopCreditMetrics implements CreditMetrics {

    static final NoopCreditMetrics INSTANCE = new NoopCreditMetrics();

    private NoopCreditMetrics() {}

    @Override
    public void recordOperation(String operation, String outcome, Duration latency) {}

    @Override
    public void recordEnvelopeIssued(long maxSats) {}

    @Override
    public void recordSettlement(String outcome, long spentSats, long feeSats) {}

    @Override
    public void recordPayment(String status) {}

    @Override
    public void updateBreakers(boolean haltNewEnvelopes, boolean haltLargeSettlements) {}
}
