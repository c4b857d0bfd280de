package in.cep.config;

import in.cep.util.Env;

/**
 * Credit policy: caps, underwriting constants, health window and breaker thresholds.
 *
 * Loaded once at startup from {@code CEP_<OPTION>} environment variables (or system properties).
 * Unlike most settings, a malformed or out-of-range value fails startup rather than falling back.
 */
public record CreditPolicyConfig(
    long maxSatsPerEnvelope,
    long maxOutstandingEnvelopesPerAgent,
    long maxOfferTtlSeconds,

    // Underwriting
    long underwritingHistoryDays,
    long underwritingBaseSats,
    double underwritingK,
    double underwritingDefaultPenaltyMultiplier,
    int minFeeBps,
    int maxFeeBps,
    double feeRiskScaler,

    // Health / circuit breakers
    long healthWindowSeconds,
    int healthSettlementSampleLimit,
    int healthLnPaySampleLimit,
    int circuitBreakerMinSample,
    double lossRateHaltThreshold,
    double lnFailureRateHaltThreshold,
    long lnFailureLargeSettlementCapSats,

    boolean exclusiveOfferAcceptance
) {
    public static final String ENV_PREFIX = "CEP_";

    public static CreditPolicyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxSatsPerEnvelope(maxSatsPerEnvelope)
            .maxOutstandingEnvelopesPerAgent(maxOutstandingEnvelopesPerAgent)
            .maxOfferTtlSeconds(maxOfferTtlSeconds)
            .underwritingHistoryDays(underwritingHistoryDays)
            .underwritingBaseSats(underwritingBaseSats)
            .underwritingK(underwritingK)
            .underwritingDefaultPenaltyMultiplier(underwritingDefaultPenaltyMultiplier)
            .minFeeBps(minFeeBps)
            .maxFeeBps(maxFeeBps)
            .feeRiskScaler(feeRiskScaler)
            .healthWindowSeconds(healthWindowSeconds)
            .healthSettlementSampleLimit(healthSettlementSampleLimit)
            .healthLnPaySampleLimit(healthLnPaySampleLimit)
            .circuitBreakerMinSample(circuitBreakerMinSample)
            .lossRateHaltThreshold(lossRateHaltThreshold)
            .lnFailureRateHaltThreshold(lnFailureRateHaltThreshold)
            .lnFailureLargeSettlementCapSats(lnFailureLargeSettlementCapSats)
            .exclusiveOfferAcceptance(exclusiveOfferAcceptance);
    }

    /**
     * Load policy from the environment, starting from the defaults.
     *
     * @throws IllegalStateException naming the offending variable if a value is malformed or out of range
     */
    public static CreditPolicyConfig fromEnv() {
        CreditPolicyConfig d = defaults();
        return new Builder()
            .maxSatsPerEnvelope(Env.requireLong(key("MAX_SATS_PER_ENVELOPE"), d.maxSatsPerEnvelope))
            .maxOutstandingEnvelopesPerAgent(Env.requireLong(key("MAX_OUTSTANDING_ENVELOPES_PER_AGENT"), d.maxOutstandingEnvelopesPerAgent))
            .maxOfferTtlSeconds(Env.requireLong(key("MAX_OFFER_TTL_SECONDS"), d.maxOfferTtlSeconds))
            .underwritingHistoryDays(Env.requireLong(key("UNDERWRITING_HISTORY_DAYS"), d.underwritingHistoryDays))
            .underwritingBaseSats(Env.requireLong(key("UNDERWRITING_BASE_SATS"), d.underwritingBaseSats))
            .underwritingK(Env.requireDouble(key("UNDERWRITING_K"), d.underwritingK))
            .underwritingDefaultPenaltyMultiplier(Env.requireDouble(key("UNDERWRITING_DEFAULT_PENALTY_MULTIPLIER"), d.underwritingDefaultPenaltyMultiplier))
            .minFeeBps(toInt("MIN_FEE_BPS", Env.requireLong(key("MIN_FEE_BPS"), d.minFeeBps)))
            .maxFeeBps(toInt("MAX_FEE_BPS", Env.requireLong(key("MAX_FEE_BPS"), d.maxFeeBps)))
            .feeRiskScaler(Env.requireDouble(key("FEE_RISK_SCALER"), d.feeRiskScaler))
            .healthWindowSeconds(Env.requireLong(key("HEALTH_WINDOW_SECONDS"), d.healthWindowSeconds))
            .healthSettlementSampleLimit(toInt("HEALTH_SETTLEMENT_SAMPLE_LIMIT", Env.requireLong(key("HEALTH_SETTLEMENT_SAMPLE_LIMIT"), d.healthSettlementSampleLimit)))
            .healthLnPaySampleLimit(toInt("HEALTH_LN_PAY_SAMPLE_LIMIT", Env.requireLong(key("HEALTH_LN_PAY_SAMPLE_LIMIT"), d.healthLnPaySampleLimit)))
            .circuitBreakerMinSample(toInt("CIRCUIT_BREAKER_MIN_SAMPLE", Env.requireLong(key("CIRCUIT_BREAKER_MIN_SAMPLE"), d.circuitBreakerMinSample)))
            .lossRateHaltThreshold(Env.requireDouble(key("LOSS_RATE_HALT_THRESHOLD"), d.lossRateHaltThreshold))
            .lnFailureRateHaltThreshold(Env.requireDouble(key("LN_FAILURE_RATE_HALT_THRESHOLD"), d.lnFailureRateHaltThreshold))
            .lnFailureLargeSettlementCapSats(Env.requireLong(key("LN_FAILURE_LARGE_SETTLEMENT_CAP_SATS"), d.lnFailureLargeSettlementCapSats))
            .exclusiveOfferAcceptance(Env.requireBool(key("EXCLUSIVE_OFFER_ACCEPTANCE"), d.exclusiveOfferAcceptance))
            .build();
    }

    /**
     * Check every option against its allowed range.
     *
     * @return this config
     * @throws IllegalStateException naming the first offending variable
     */
    public CreditPolicyConfig validate() {
        atLeast("MAX_SATS_PER_ENVELOPE", maxSatsPerEnvelope, 1);
        atLeast("MAX_OUTSTANDING_ENVELOPES_PER_AGENT", maxOutstandingEnvelopesPerAgent, 1);
        inRange("MAX_OFFER_TTL_SECONDS", maxOfferTtlSeconds, 1, 86_400);
        inRange("UNDERWRITING_HISTORY_DAYS", underwritingHistoryDays, 1, 365);
        atLeast("UNDERWRITING_BASE_SATS", underwritingBaseSats, 1);
        inRange("UNDERWRITING_K", underwritingK, 0.0, 10_000.0);
        inRange("UNDERWRITING_DEFAULT_PENALTY_MULTIPLIER", underwritingDefaultPenaltyMultiplier, 0.0, 100.0);
        inRange("MIN_FEE_BPS", minFeeBps, 0, 100_000);
        inRange("MAX_FEE_BPS", maxFeeBps, minFeeBps, 100_000);
        inRange("FEE_RISK_SCALER", feeRiskScaler, 0.0, 100_000.0);
        inRange("HEALTH_WINDOW_SECONDS", healthWindowSeconds, 60, 604_800);
        inRange("HEALTH_SETTLEMENT_SAMPLE_LIMIT", healthSettlementSampleLimit, 1, 100_000);
        inRange("HEALTH_LN_PAY_SAMPLE_LIMIT", healthLnPaySampleLimit, 1, 100_000);
        inRange("CIRCUIT_BREAKER_MIN_SAMPLE", circuitBreakerMinSample, 1, 100_000);
        inRange("LOSS_RATE_HALT_THRESHOLD", lossRateHaltThreshold, 0.0, 1.0);
        inRange("LN_FAILURE_RATE_HALT_THRESHOLD", lnFailureRateHaltThreshold, 0.0, 1.0);
        atLeast("LN_FAILURE_LARGE_SETTLEMENT_CAP_SATS", lnFailureLargeSettlementCapSats, 1);
        return this;
    }

    private static String key(String option) {
        return ENV_PREFIX + option;
    }

    private static int toInt(String option, long value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalStateException("invalid " + key(option) + ": out of range: " + value);
        }
        return (int) value;
    }

    private static void atLeast(String option, long value, long min) {
        if (value < min) {
            throw new IllegalStateException("invalid " + key(option) + ": must be >= " + min + ", got " + value);
        }
    }

    private static void inRange(String option, long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalStateException("invalid " + key(option)
                + ": must be between " + min + " and " + max + ", got " + value);
        }
    }

    private static void inRange(String option, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalStateException("invalid " + key(option)
                + ": must be between " + min + " and " + max + ", got " + value);
        }
    }

    /**
     * Builder seeded with the production defaults.
     */
    public static final class Builder {
        private long maxSatsPerEnvelope = 100_000;
        private long maxOutstandingEnvelopesPerAgent = 3;
        private long maxOfferTtlSeconds = 3_600;
        private long underwritingHistoryDays = 30;
        private long underwritingBaseSats = 2_000;
        private double underwritingK = 150.0;
        private double underwritingDefaultPenaltyMultiplier = 2.0;
        private int minFeeBps = 50;
        private int maxFeeBps = 2_000;
        private double feeRiskScaler = 400.0;
        private long healthWindowSeconds = 21_600;
        private int healthSettlementSampleLimit = 200;
        private int healthLnPaySampleLimit = 200;
        private int circuitBreakerMinSample = 5;
        private double lossRateHaltThreshold = 0.50;
        private double lnFailureRateHaltThreshold = 0.50;
        private long lnFailureLargeSettlementCapSats = 5_000;
        private boolean exclusiveOfferAcceptance = true;

        private Builder() {}

        public Builder maxSatsPerEnvelope(long value) { this.maxSatsPerEnvelope = value; return this; }
        public Builder maxOutstandingEnvelopesPerAgent(long value) { this.maxOutstandingEnvelopesPerAgent = value; return this; }
        public Builder maxOfferTtlSeconds(long value) { this.maxOfferTtlSeconds = value; return this; }
        public Builder underwritingHistoryDays(long value) { this.underwritingHistoryDays = value; return this; }
        public Builder underwritingBaseSats(long value) { this.underwritingBaseSats = value; return this; }
        public Builder underwritingK(double value) { this.underwritingK = value; return this; }
        public Builder underwritingDefaultPenaltyMultiplier(double value) { this.underwritingDefaultPenaltyMultiplier = value; return this; }
        public Builder minFeeBps(int value) { this.minFeeBps = value; return this; }
        public Builder maxFeeBps(int value) { this.maxFeeBps = value; return this; }
        public Builder feeRiskScaler(double value) { this.feeRiskScaler = value; return this; }
        public Builder healthWindowSeconds(long value) { this.healthWindowSeconds = value; return this; }
        public Builder healthSettlementSampleLimit(int value) { this.healthSettlementSampleLimit = value; return this; }
        public Builder healthLnPaySampleLimit(int value) { this.healthLnPaySampleLimit = value; return this; }
        public Builder circuitBreakerMinSample(int value) { this.circuitBreakerMinSample = value; return this; }
        public Builder lossRateHaltThreshold(double value) { this.lossRateHaltThreshold = value; return this; }
        public Builder lnFailureRateHaltThreshold(double value) { this.lnFailureRateHaltThreshold = value; return this; }
        public Builder lnFailureLargeSettlementCapSats(long value) { this.lnFailureLargeSettlementCapSats = value; return this; }
        public Builder exclusiveOfferAcceptance(boolean value) { this.exclusiveOfferAcceptance = value; return this; }

        /**
         * @throws IllegalStateException if any option is out of range
         */
        public CreditPolicyConfig build() {
            return new CreditPolicyConfig(
                maxSatsPerEnvelope, maxOutstandingEnvelopesPerAgent, maxOfferTtlSeconds,
                underwritingHistoryDays, underwritingBaseSats, underwritingK,
                underwritingDefaultPenaltyMultiplier, minFeeBps, maxFeeBps, feeRiskScaler,
                healthWindowSeconds, healthSettlementSampleLimit, healthLnPaySampleLimit,
                circuitBreakerMinSample, lossRateHaltThreshold, lnFailureRateHaltThreshold,
                lnFailureLargeSettlementCapSats, exclusiveOfferAcceptance
            ).validate();
        }
    }
}
