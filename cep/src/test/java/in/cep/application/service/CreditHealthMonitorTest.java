package in.cep.application.service;

import in.cep.config.CreditPolicyConfig;
import in.cep.domain.credit.LiquidityPayEvent;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;
import in.cep.domain.protocol.HealthReport;
import in.cep.infrastructure.metrics.CreditMetrics;
import in.cep.infrastructure.persistence.InMemoryCreditStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CreditHealthMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private CreditMetrics metrics;

    private InMemoryCreditStore store;
    private CreditHealthMonitor monitor;
    private int seq;

    @BeforeEach
    void setUp() {
        store = new InMemoryCreditStore();
        monitor = new CreditHealthMonitor(store, CreditPolicyConfig.defaults(), metrics);
    }

    @Test
    void evaluate_emptyHistoryKeepsBreakersClear() {
        HealthReport report = monitor.evaluate(NOW);

        assertEquals(0, report.settlementSample());
        assertEquals(0.0, report.lossRate());
        assertFalse(report.breakers().haltNewEnvelopes());
        assertFalse(report.breakers().haltLargeSettlements());
        verify(metrics).updateBreakers(false, false);
    }

    @Test
    void evaluate_lossRateAboveThresholdHaltsNewEnvelopes() {
        addSettlements(SettlementOutcome.EXPIRED, 3, NOW.minusSeconds(60));
        addSettlements(SettlementOutcome.SUCCESS, 2, NOW.minusSeconds(60));

        HealthReport report = monitor.evaluate(NOW);

        assertEquals(5, report.settlementSample());
        assertEquals(3, report.lossCount());
        assertEquals(0.6, report.lossRate(), 1e-9);
        assertTrue(report.breakers().haltNewEnvelopes());
        verify(metrics).updateBreakers(true, false);
    }

    @Test
    void evaluate_smallSampleNeverTrips() {
        addSettlements(SettlementOutcome.FAILED, 4, NOW.minusSeconds(60));

        HealthReport report = monitor.evaluate(NOW);

        assertEquals(1.0, report.lossRate(), 1e-9);
        assertFalse(report.breakers().haltNewEnvelopes());
    }

    @Test
    void evaluate_lossRateAtThresholdDoesNotTrip() {
        addSettlements(SettlementOutcome.FAILED, 3, NOW.minusSeconds(60));
        addSettlements(SettlementOutcome.SUCCESS, 3, NOW.minusSeconds(60));

        assertFalse(monitor.evaluate(NOW).breakers().haltNewEnvelopes());
    }

    @Test
    void evaluate_settlementsOutsideWindowAreIgnored() {
        addSettlements(SettlementOutcome.FAILED, 10, NOW.minusSeconds(21_601));

        HealthReport report = monitor.evaluate(NOW);

        assertEquals(0, report.settlementSample());
        assertFalse(report.breakers().haltNewEnvelopes());
    }

    @Test
    void evaluate_lightningFailuresHaltLargeSettlements() {
        for (int i = 0; i < 3; i++) {
            store.putLiquidityPayEvent(payEvent("failed", NOW.minusSeconds(30)));
        }
        for (int i = 0; i < 2; i++) {
            store.putLiquidityPayEvent(payEvent(LiquidityPayEvent.STATUS_SUCCEEDED, NOW.minusSeconds(30)));
        }

        HealthReport report = monitor.evaluate(NOW);

        assertEquals(5, report.lnPaySample());
        assertEquals(3, report.lnFailCount());
        assertTrue(report.breakers().haltLargeSettlements());
        assertFalse(report.breakers().haltNewEnvelopes());
        verify(metrics).updateBreakers(false, true);
    }

    private void addSettlements(SettlementOutcome outcome, int count, Instant at) {
        for (int i = 0; i < count; i++) {
            String id = "h" + (seq++);
            store.createOrGetSettlement(new Settlement("ceps_" + id, "cepe_" + id, "agent-" + id, "pool-1", "provider-1",
                outcome, outcome.isLoss() ? 0 : 100, 0, !outcome.isLoss(), "vsha", null, at), "fp-" + id);
        }
    }

    private LiquidityPayEvent payEvent(String status, Instant at) {
        String id = "q" + (seq++);
        return new LiquidityPayEvent(id, "cepe_" + id, status, null, 100_000, "provider.example", at);
    }
}
