package in.cep.domain.credit;

/**
 * Envelope status. SETTLED and DEFAULTED are terminal.
 */
public enum EnvelopeStatus {
    ACCEPTED,
    SETTLED,
    DEFAULTED;

    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != ACCEPTED;
    }

    public static EnvelopeStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
