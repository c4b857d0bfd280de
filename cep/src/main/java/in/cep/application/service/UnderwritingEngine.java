package in.cep.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.cep.application.port.output.CreditStore;
import in.cep.config.CreditPolicyConfig;
import in.cep.domain.credit.CreditSchemas;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.UnderwritingDecision;
import in.cep.domain.credit.UnderwritingStats;
import in.cep.security.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns an agent's settlement history into a credit limit, fee rate and verifier requirement.
 *
 * <pre>
 * raw_limit        = base_sats + k * sqrt(success_volume)
 * loss_penalty     = 1 / (1 + weighted_loss_score * default_penalty_multiplier)
 * exposure_penalty = 1 / (1 + open_exposure / max(raw_limit, 1))      (1.0 when raw_limit &lt;= 1)
 * limit_sats       = clamp(round(raw_limit * loss_penalty * exposure_penalty), 1, max_sats_per_envelope)
 * risk_score       = 2 * (1 - pass_rate) + 0.5 * weighted_loss_score + sqrt(min(open_exposure / 50000, 50))
 * fee_bps          = clamp(round(risk_score * fee_risk_scaler), min_fee_bps, max_fee_bps)
 * </pre>
 *
 * Losses decay with age: 1.0 within an hour, 0.75 within a day, 0.5 within a week, 0.25 after that.
 * Reads only; the caller persists the audit record.
 */
public final class UnderwritingEngine {
    private static final Logger log = LoggerFactory.getLogger(UnderwritingEngine.class);

    private static final int MIN_HISTORY_SAMPLE = 200;

    private final CreditStore store;
    private final CreditPolicyConfig policy;

    public UnderwritingEngine(CreditStore store, CreditPolicyConfig policy) {
        this.store = store;
        this.policy = policy;
    }

    public UnderwritingDecision evaluate(String agentId, Instant now) {
        Instant since = now.minus(Duration.ofDays(Math.max(policy.underwritingHistoryDays(), 1)));
        List<Settlement> history = store.listRecentSettlementsForAgent(
            agentId, since, Math.max(policy.healthSettlementSampleLimit(), MIN_HISTORY_SAMPLE));
        OpenEnvelopeStats open = store.getAgentOpenEnvelopeStats(agentId, now);

        UnderwritingStats stats = summarize(history, open, now);
        UnderwritingDecision decision = decide(stats, policy, auditInputs(agentId, since, stats));

        log.debug("[UNDERWRITING] agent={} settled={} passRate={} wls={} exposure={} -> limit={} fee={}",
            agentId, stats.settledCount30d(), stats.passRate30d(), stats.weightedLossScore(),
            stats.openExposureSats(), decision.limitSats(), decision.feeBps());
        return decision;
    }

    /**
     * Aggregate raw settlement rows into underwriting stats.
     */
    public static UnderwritingStats summarize(List<Settlement> history, OpenEnvelopeStats open, Instant now) {
        long successVolume = 0;
        int successCount = 0;
        int lossCount = 0;
        double weightedLossScore = 0.0;

        for (Settlement row : history) {
            if (row.outcome().isLoss()) {
                lossCount++;
                weightedLossScore += lossWeight(now, row.createdAt());
            } else {
                successCount++;
                successVolume += Math.max(row.spentSats(), 0);
            }
        }

        int settled = history.size();
        double passRate = settled == 0 ? 1.0 : (double) successCount / settled;
        return new UnderwritingStats(settled, successVolume, passRate, lossCount, weightedLossScore,
            open.count(), Math.max(open.reservedSats(), 0));
    }

    /**
     * Pure decision over already aggregated stats.
     */
    public static UnderwritingDecision decide(UnderwritingStats stats, CreditPolicyConfig policy, JsonNode auditInputs) {
        double rawLimit = policy.underwritingBaseSats()
            + policy.underwritingK() * Math.sqrt(stats.successVolumeSats30d());
        double lossPenalty = 1.0 / (1.0 + stats.weightedLossScore() * policy.underwritingDefaultPenaltyMultiplier());
        double exposurePenalty = rawLimit <= 1.0
            ? 1.0
            : 1.0 / (1.0 + stats.openExposureSats() / Math.max(rawLimit, 1.0));

        long limitSats = clamp(Math.round(rawLimit * lossPenalty * exposurePenalty), 1, policy.maxSatsPerEnvelope());

        double riskScore = Math.max(1.0 - stats.passRate30d(), 0.0) * 2.0
            + stats.weightedLossScore() * 0.5
            + Math.sqrt(Math.min(stats.openExposureSats() / 50_000.0, 50.0));
        int feeBps = (int) clamp(Math.round(riskScore * policy.feeRiskScaler()), policy.minFeeBps(), policy.maxFeeBps());

        // No envelope may bypass verification.
        return new UnderwritingDecision(limitSats, feeBps, true, riskScore, stats, auditInputs);
    }

    static double lossWeight(Instant now, Instant createdAt) {
        long ageSeconds = Math.max(Duration.between(createdAt, now).getSeconds(), 0);
        if (ageSeconds <= 3_600) {
            return 1.0;
        } else if (ageSeconds <= 86_400) {
            return 0.75;
        } else if (ageSeconds <= 7 * 86_400) {
            return 0.50;
        }
        return 0.25;
    }

    private JsonNode auditInputs(String agentId, Instant since, UnderwritingStats stats) {
        ObjectNode inputs = CanonicalJson.object();
        inputs.put("schema", CreditSchemas.UNDERWRITING_INPUTS);
        inputs.put("agentId", agentId);
        inputs.put("since", since.toString());
        inputs.put("settledCount30d", stats.settledCount30d());
        inputs.put("successVolumeSats30d", stats.successVolumeSats30d());
        inputs.put("passRate30d", stats.passRate30d());
        inputs.put("lossCount30d", stats.lossCount30d());
        inputs.put("weightedLossScore", stats.weightedLossScore());
        inputs.put("openEnvelopeCount", stats.openEnvelopeCount());
        inputs.put("openExposureSats", stats.openExposureSats());

        ObjectNode policyNode = inputs.putObject("policy");
        policyNode.put("baseSats", policy.underwritingBaseSats());
        policyNode.put("k", policy.underwritingK());
        policyNode.put("defaultPenaltyMultiplier", policy.underwritingDefaultPenaltyMultiplier());
        policyNode.put("maxSatsPerEnvelope", policy.maxSatsPerEnvelope());
        return inputs;
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
