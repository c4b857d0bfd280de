package in.cep.domain.protocol;

public record CircuitBreakers(boolean haltNewEnvelopes, boolean haltLargeSettlements) {}
