package in.cep.domain.credit;

/**
 * An agent's settlement history over the underwriting window plus its current open exposure.
 */
public record UnderwritingStats(
    int settledCount30d,
    long successVolumeSats30d,
    double passRate30d,
    int lossCount30d,
    double weightedLossScore,
    long openEnvelopeCount,
    long openExposureSats
) {
    public static UnderwritingStats noHistory() {
        return new UnderwritingStats(0, 0, 1.0, 0, 0.0, 0, 0);
    }
}
