package in.cep.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of CreditMetrics.
 *
 * Key Metrics:
 * - cep_operations_total{operation, outcome} - Protocol operation outcomes
 * - cep_operation_latency_seconds{operation} - Operation latency distribution
 * - cep_envelopes_issued_total / cep_envelope_issued_sats_total - Issuance volume
 * - cep_settlements_total{outcome} - Settlement outcomes
 * - cep_settled_sats_total / cep_settlement_fee_sats_total - Settled volume and fees
 * - cep_ln_payments_total{status} - Lightning payment attempts
 * - cep_breaker_open{breaker} - Circuit breaker state (1=halted, 0=clear)
 */
public class PrometheusCreditMetrics implements CreditMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusCreditMetrics.class);

    private final CollectorRegistry registry;

    private final Counter operationCounter;
    private final Histogram operationLatency;

    private final Counter envelopesIssued;
    private final Counter envelopeIssuedSats;

    private final Counter settlementCounter;
    private final Counter settledSats;
    private final Counter feeSats;

    private final Counter paymentCounter;

    private final Gauge breakerOpen;

    public PrometheusCreditMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusCreditMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.operationCounter = Counter.build()
            .name("cep_operations_total")
            .help("Total number of credit protocol operations")
            .labelNames("operation", "outcome")
            .register(registry);

        this.operationLatency = Histogram.build()
            .name("cep_operation_latency_seconds")
            .help("Credit protocol operation latency in seconds")
            .labelNames("operation")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.envelopesIssued = Counter.build()
            .name("cep_envelopes_issued_total")
            .help("Total number of envelopes issued")
            .register(registry);

        this.envelopeIssuedSats = Counter.build()
            .name("cep_envelope_issued_sats_total")
            .help("Total credit committed by issued envelopes in sats")
            .register(registry);

        this.settlementCounter = Counter.build()
            .name("cep_settlements_total")
            .help("Total number of settlements by outcome")
            .labelNames("outcome")
            .register(registry);

        this.settledSats = Counter.build()
            .name("cep_settled_sats_total")
            .help("Total sats spent by successful settlements")
            .register(registry);

        this.feeSats = Counter.build()
            .name("cep_settlement_fee_sats_total")
            .help("Total fees charged by successful settlements in sats")
            .register(registry);

        this.paymentCounter = Counter.build()
            .name("cep_ln_payments_total")
            .help("Total number of Lightning payment attempts by status")
            .labelNames("status")
            .register(registry);

        this.breakerOpen = Gauge.build()
            .name("cep_breaker_open")
            .help("Circuit breaker state (1=halted, 0=clear)")
            .labelNames("breaker")
            .register(registry);

        log.info("[PrometheusCreditMetrics] Initialized credit metrics");
    }

    @Override
    public void recordOperation(String operation, String outcome, Duration latency) {
        operationCounter.labels(operation, outcome).inc();
        operationLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordEnvelopeIssued(long maxSats) {
        envelopesIssued.inc();
        envelopeIssuedSats.inc(maxSats);
    }

    @Override
    public void recordSettlement(String outcome, long spent, long fee) {
        settlementCounter.labels(outcome).inc();
        if (spent > 0) {
            settledSats.inc(spent);
        }
        if (fee > 0) {
            feeSats.inc(fee);
        }
    }

    @Override
    public void recordPayment(String status) {
        paymentCounter.labels(status == null ? "unknown" : status).inc();
    }

    @Override
    public void updateBreakers(boolean haltNewEnvelopes, boolean haltLargeSettlements) {
        breakerOpen.labels("halt_new_envelopes").set(haltNewEnvelopes ? 1 : 0);
        breakerOpen.labels("halt_large_settlements").set(haltLargeSettlements ? 1 : 0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
