package in.cep.application.service;

import in.cep.application.port.output.CreditStore;
import in.cep.config.CreditPolicyConfig;
import in.cep.domain.credit.CreditSchemas;
import in.cep.domain.credit.LiquidityPayEvent;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.Settlement;
import in.cep.domain.protocol.CircuitBreakers;
import in.cep.domain.protocol.HealthReport;
import in.cep.infrastructure.metrics.CreditMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Pool-wide circuit breakers, recomputed from bounded samples on every call.
 *
 * halt_new_envelopes: settlement sample &gt;= min sample and loss rate &gt; loss threshold.
 * halt_large_settlements: Lightning pay sample &gt;= min sample and failure rate &gt; failure threshold.
 */
public final class CreditHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(CreditHealthMonitor.class);

    private static final long MIN_WINDOW_SECONDS = 60;
    private static final int MIN_SAMPLE_LIMIT = 50;

    private final CreditStore store;
    private final CreditPolicyConfig policy;
    private final CreditMetrics metrics;

    public CreditHealthMonitor(CreditStore store, CreditPolicyConfig policy, CreditMetrics metrics) {
        this.store = store;
        this.policy = policy;
        this.metrics = metrics;
    }

    public HealthReport evaluate(Instant now) {
        Instant since = now.minusSeconds(Math.max(policy.healthWindowSeconds(), MIN_WINDOW_SECONDS));
        OpenEnvelopeStats open = store.getGlobalOpenEnvelopeStats(now);

        List<Settlement> settlements = store.listRecentSettlements(
            since, Math.max(policy.healthSettlementSampleLimit(), MIN_SAMPLE_LIMIT));
        int settlementSample = settlements.size();
        int lossCount = (int) settlements.stream().filter(s -> s.outcome().isLoss()).count();
        double lossRate = rate(lossCount, settlementSample);

        List<LiquidityPayEvent> payEvents = store.listRecentLiquidityPayEvents(
            since, Math.max(policy.healthLnPaySampleLimit(), MIN_SAMPLE_LIMIT));
        int lnPaySample = payEvents.size();
        int lnFailCount = (int) payEvents.stream().filter(e -> !e.succeeded()).count();
        double lnFailureRate = rate(lnFailCount, lnPaySample);

        CircuitBreakers breakers = new CircuitBreakers(
            settlementSample >= policy.circuitBreakerMinSample() && lossRate > policy.lossRateHaltThreshold(),
            lnPaySample >= policy.circuitBreakerMinSample() && lnFailureRate > policy.lnFailureRateHaltThreshold());

        metrics.updateBreakers(breakers.haltNewEnvelopes(), breakers.haltLargeSettlements());
        if (breakers.haltNewEnvelopes() || breakers.haltLargeSettlements()) {
            log.warn("[HEALTH] breakers tripped: halt_new_envelopes={} (loss {}/{}), halt_large_settlements={} (ln fail {}/{})",
                breakers.haltNewEnvelopes(), lossCount, settlementSample,
                breakers.haltLargeSettlements(), lnFailCount, lnPaySample);
        }

        return new HealthReport(
            CreditSchemas.HEALTH_RESPONSE,
            now,
            open.count(),
            Math.max(open.reservedSats(), 0),
            settlementSample,
            lossCount,
            lossRate,
            lnPaySample,
            lnFailCount,
            lnFailureRate,
            breakers,
            policy
        );
    }

    private static double rate(int count, int sample) {
        return sample == 0 ? 0.0 : (double) count / sample;
    }
}
