package in.cep.domain.credit;

/**
 * Count and reserved sats of open envelopes.
 */
public record OpenEnvelopeStats(long count, long reservedSats) {

    public static OpenEnvelopeStats empty() {
        return new OpenEnvelopeStats(0, 0);
    }
}
