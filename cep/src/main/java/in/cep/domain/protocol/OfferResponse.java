package in.cep.domain.protocol;

import in.cep.domain.credit.Offer;

/**
 * Stored offer plus both sides of the underwriting override.
 * {@code granted} always equals the terms persisted on {@code offer}.
 */
public record OfferResponse(
    String schema,
    Offer offer,
    OfferTerms requested,
    OfferTerms granted,
    double riskScore
) {
    public boolean termsOverridden() {
        return !requested.equals(granted);
    }
}
