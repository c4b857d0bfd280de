package in.cep.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class PrometheusCreditMetricsTest {

    private CollectorRegistry registry;
    private PrometheusCreditMetrics metrics;

    @BeforeEach
    public void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusCreditMetrics(registry);
    }

    @Test
    public void testOperationOutcomesCountedPerLabel() {
        metrics.recordOperation("settle", "ok", Duration.ofMillis(20));
        metrics.recordOperation("settle", "ok", Duration.ofMillis(30));
        metrics.recordOperation("settle", "conflict", Duration.ofMillis(5));

        assertEquals(2.0, sample("cep_operations_total", new String[]{"operation", "outcome"}, "settle", "ok"));
        assertEquals(1.0, sample("cep_operations_total", new String[]{"operation", "outcome"}, "settle", "conflict"));
        assertEquals(3.0, sample("cep_operation_latency_seconds_count", new String[]{"operation"}, "settle"));
    }

    @Test
    public void testSettlementVolumes() {
        metrics.recordEnvelopeIssued(400);
        metrics.recordSettlement("success", 300, 2);
        metrics.recordSettlement("expired", 0, 0);

        assertEquals(1.0, registry.getSampleValue("cep_envelopes_issued_total"));
        assertEquals(400.0, registry.getSampleValue("cep_envelope_issued_sats_total"));
        assertEquals(300.0, registry.getSampleValue("cep_settled_sats_total"));
        assertEquals(2.0, registry.getSampleValue("cep_settlement_fee_sats_total"));
        assertEquals(1.0, sample("cep_settlements_total", new String[]{"outcome"}, "expired"));
    }

    @Test
    public void testBreakerGauges() {
        metrics.updateBreakers(true, false);

        assertEquals(1.0, sample("cep_breaker_open", new String[]{"breaker"}, "halt_new_envelopes"));
        assertEquals(0.0, sample("cep_breaker_open", new String[]{"breaker"}, "halt_large_settlements"));

        metrics.updateBreakers(false, false);
        assertEquals(0.0, sample("cep_breaker_open", new String[]{"breaker"}, "halt_new_envelopes"));
    }

    @Test
    public void testPaymentStatusCounter() {
        metrics.recordPayment("succeeded");
        metrics.recordPayment(null);

        assertEquals(1.0, sample("cep_ln_payments_total", new String[]{"status"}, "succeeded"));
        assertEquals(1.0, sample("cep_ln_payments_total", new String[]{"status"}, "unknown"));
    }

    private Double sample(String name, String[] labelNames, String... labelValues) {
        return registry.getSampleValue(name, labelNames, labelValues);
    }
}
