package in.cep.domain.protocol;

import in.cep.config.CreditPolicyConfig;

import java.time.Instant;

/**
 * Pool-wide health over the trailing window, with the breakers derived from it.
 */
public record HealthReport(
    String schema,
    Instant generatedAt,
    long openEnvelopeCount,
    long openReservedSats,
    int settlementSample,
    int lossCount,
    double lossRate,
    int lnPaySample,
    int lnFailCount,
    double lnFailureRate,
    CircuitBreakers breakers,
    CreditPolicyConfig policy
) {}
