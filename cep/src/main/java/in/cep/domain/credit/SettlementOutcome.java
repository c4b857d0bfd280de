package in.cep.domain.credit;

/**
 * Settlement outcome. Anything other than SUCCESS counts as a loss for underwriting and health.
 */
public enum SettlementOutcome {
    SUCCESS,
    FAILED,       // verification failed
    EXPIRED;      // settled after envelope expiry

    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isLoss() {
        return this != SUCCESS;
    }

    /**
     * Schema of the receipt stored for a settlement with this outcome.
     */
    public String receiptSchema() {
        return this == SUCCESS
            ? CreditSchemas.ENVELOPE_SETTLEMENT_RECEIPT
            : CreditSchemas.DEFAULT_NOTICE;
    }

    public static SettlementOutcome fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
