package in.cep.application.service;

import in.cep.config.CreditPolicyConfig;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;
import in.cep.domain.credit.UnderwritingDecision;
import in.cep.domain.credit.UnderwritingStats;
import in.cep.infrastructure.persistence.InMemoryCreditStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Underwriting Engine Tests")
class UnderwritingEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final CreditPolicyConfig POLICY = CreditPolicyConfig.defaults();

    @Test
    void decide_noHistoryGrantsBaseLimitAtMinimumFee() {
        UnderwritingDecision decision = UnderwritingEngine.decide(UnderwritingStats.noHistory(), POLICY, null);

        assertEquals(2_000, decision.limitSats());
        assertEquals(50, decision.feeBps());
        assertTrue(decision.requiresVerifier());
        assertEquals(0.0, decision.riskScore(), 1e-9);
    }

    @Test
    void decide_successVolumeRaisesLimitBySquareRoot() {
        UnderwritingStats stats = new UnderwritingStats(10, 10_000, 1.0, 0, 0.0, 0, 0);

        UnderwritingDecision decision = UnderwritingEngine.decide(stats, POLICY, null);

        // 2000 + 150 * sqrt(10000)
        assertEquals(17_000, decision.limitSats());
        assertEquals(50, decision.feeBps());
    }

    @Test
    void decide_weightedLossesCutLimitAndRaiseFee() {
        UnderwritingStats stats = new UnderwritingStats(2, 0, 0.5, 1, 1.0, 0, 0);

        UnderwritingDecision decision = UnderwritingEngine.decide(stats, POLICY, null);

        // 2000 / (1 + 1.0 * 2.0)
        assertEquals(667, decision.limitSats());
        // risk = 2 * 0.5 + 0.5 * 1.0 = 1.5
        assertEquals(1.5, decision.riskScore(), 1e-9);
        assertEquals(600, decision.feeBps());
    }

    @Test
    void decide_openExposureHalvesLimitWhenEqualToRawLimit() {
        UnderwritingStats stats = new UnderwritingStats(0, 0, 1.0, 0, 0.0, 1, 2_000);

        UnderwritingDecision decision = UnderwritingEngine.decide(stats, POLICY, null);

        assertEquals(1_000, decision.limitSats());
        // sqrt(2000 / 50000) = 0.2 -> 80 bps
        assertEquals(80, decision.feeBps());
    }

    @Test
    void decide_clampsToPolicyBounds() {
        CreditPolicyConfig rich = POLICY.toBuilder().underwritingBaseSats(500_000).build();
        assertEquals(100_000, UnderwritingEngine.decide(UnderwritingStats.noHistory(), rich, null).limitSats());

        UnderwritingStats awful = new UnderwritingStats(10, 0, 0.0, 10, 10.0, 0, 0);
        UnderwritingDecision decision = UnderwritingEngine.decide(awful, POLICY, null);
        assertEquals(2_000, decision.feeBps());
        assertTrue(decision.limitSats() >= 1);
    }

    @Test
    void decide_moreLossesNeverRaiseTheLimit() {
        long previous = Long.MAX_VALUE;
        for (double wls = 0.0; wls <= 5.0; wls += 0.25) {
            UnderwritingStats stats = new UnderwritingStats(4, 5_000, 0.5, 2, wls, 0, 0);
            long limit = UnderwritingEngine.decide(stats, POLICY, null).limitSats();
            assertTrue(limit <= previous, "limit rose at wls=" + wls);
            previous = limit;
        }
    }

    @Test
    void lossWeight_decaysWithAge() {
        assertEquals(1.0, UnderwritingEngine.lossWeight(NOW, NOW));
        assertEquals(1.0, UnderwritingEngine.lossWeight(NOW, NOW.minusSeconds(3_600)));
        assertEquals(0.75, UnderwritingEngine.lossWeight(NOW, NOW.minusSeconds(3_601)));
        assertEquals(0.75, UnderwritingEngine.lossWeight(NOW, NOW.minusSeconds(86_400)));
        assertEquals(0.5, UnderwritingEngine.lossWeight(NOW, NOW.minusSeconds(86_401)));
        assertEquals(0.5, UnderwritingEngine.lossWeight(NOW, NOW.minus(Duration.ofDays(7))));
        assertEquals(0.25, UnderwritingEngine.lossWeight(NOW, NOW.minus(Duration.ofDays(8))));
        // Clock skew: a row from the future counts as fresh
        assertEquals(1.0, UnderwritingEngine.lossWeight(NOW, NOW.plusSeconds(30)));
    }

    @Test
    void summarize_countsSuccessVolumeAndWeightedLosses() {
        List<Settlement> history = List.of(
            settlement("s1", SettlementOutcome.SUCCESS, 300, NOW.minusSeconds(60)),
            settlement("s2", SettlementOutcome.SUCCESS, 700, NOW.minus(Duration.ofDays(2))),
            settlement("s3", SettlementOutcome.EXPIRED, 0, NOW.minusSeconds(120)),
            settlement("s4", SettlementOutcome.FAILED, 0, NOW.minus(Duration.ofDays(3))));

        UnderwritingStats stats = UnderwritingEngine.summarize(history, new OpenEnvelopeStats(2, 900), NOW);

        assertEquals(4, stats.settledCount30d());
        assertEquals(1_000, stats.successVolumeSats30d());
        assertEquals(0.5, stats.passRate30d(), 1e-9);
        assertEquals(2, stats.lossCount30d());
        assertEquals(1.5, stats.weightedLossScore(), 1e-9);
        assertEquals(2, stats.openEnvelopeCount());
        assertEquals(900, stats.openExposureSats());
    }

    @Test
    void evaluate_ignoresSettlementsOutsideHistoryWindow() {
        InMemoryCreditStore store = new InMemoryCreditStore();
        store.createOrGetSettlement(settlement("recent", SettlementOutcome.SUCCESS, 400, NOW.minus(Duration.ofDays(1))), "fp1");
        store.createOrGetSettlement(settlement("old", SettlementOutcome.FAILED, 0, NOW.minus(Duration.ofDays(45))), "fp2");

        UnderwritingDecision decision = new UnderwritingEngine(store, POLICY).evaluate("agent-1", NOW);

        assertEquals(1, decision.stats().settledCount30d());
        assertEquals(0, decision.stats().lossCount30d());
        assertEquals(1.0, decision.stats().passRate30d(), 1e-9);
        assertEquals("agent-1", decision.auditInputs().get("agentId").asText());
        assertEquals(2_000, decision.auditInputs().get("policy").get("baseSats").asLong());
    }

    private static Settlement settlement(String id, SettlementOutcome outcome, long spent, Instant createdAt) {
        return new Settlement("ceps_" + id, "cepe_" + id, "agent-1", "pool-1", "provider-1",
            outcome, spent, 0, !outcome.isLoss(), "vsha", null, createdAt);
    }
}
