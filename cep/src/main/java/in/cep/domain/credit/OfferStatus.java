package in.cep.domain.credit;

/**
 * Offer status.
 */
public enum OfferStatus {
    OFFERED,      // Underwritten, waiting for a provider
    ACCEPTED;     // An envelope was minted against it

    public String wireValue() {
        return name().toLowerCase();
    }

    public static OfferStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
