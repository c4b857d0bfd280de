package in.cep.domain.protocol;

public record EnvelopeRequest(String schema, String offerId, String providerId) {}
