package in.cep.domain.protocol;

import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;

/**
 * Stored settlement plus its receipt. {@code replayed} is true when an earlier settlement was returned as-is.
 */
public record SettleResponse(
    String schema,
    Settlement settlement,
    CreditReceipt receipt,
    boolean replayed
) {
    public String envelopeId() {
        return settlement.envelopeId();
    }

    public String settlementId() {
        return settlement.settlementId();
    }

    public SettlementOutcome outcome() {
        return settlement.outcome();
    }

    public long spentSats() {
        return settlement.spentSats();
    }

    public long feeSats() {
        return settlement.feeSats();
    }

    public boolean verificationPassed() {
        return settlement.verificationPassed();
    }
}
