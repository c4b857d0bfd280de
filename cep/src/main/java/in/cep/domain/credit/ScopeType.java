package in.cep.domain.credit;

/**
 * What an envelope may be spent on.
 */
public enum ScopeType {
    NIP90("nip90");   // NIP-90 data vending job

    private final String wireValue;

    ScopeType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolve a wire value, ignoring case and surrounding whitespace.
     *
     * @return the scope type, or null when the value is not recognized
     */
    public static ScopeType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (ScopeType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
