package in.cep.domain.protocol;

/**
 * Credit terms, either as requested by the caller or as granted by underwriting.
 */
public record OfferTerms(long maxSats, int feeBps, boolean requiresVerifier) {}
