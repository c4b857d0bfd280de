package in.cep.security;

import in.cep.domain.common.CreditException;
import in.cep.domain.credit.ScopeType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Validation of protocol request fields. Every failure is an INVALID_REQUEST.
 *
 * Rules:
 * - Identifiers: non-blank after trimming, at most 256 chars, no control characters
 * - Amounts: positive and within the configured cap
 * - Expiries: strictly in the future and within the offer TTL, normalized to millisecond precision
 */
public class CreditRequestValidator {

    private static final int MAX_ID_LENGTH = 256;
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    public void requireSchema(String actual, String expected) {
        if (!expected.equals(actual == null ? null : actual.trim())) {
            throw CreditException.invalidRequest("schema must be " + expected);
        }
    }

    /**
     * @return the trimmed identifier
     */
    public String requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw CreditException.invalidRequest(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_ID_LENGTH) {
            throw CreditException.invalidRequest(field + " exceeds " + MAX_ID_LENGTH + " characters");
        }
        if (CONTROL_CHARS.matcher(trimmed).find()) {
            throw CreditException.invalidRequest(field + " contains control characters");
        }
        return trimmed;
    }

    /**
     * @return the trimmed value, or null when absent or blank
     */
    public String optionalId(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return requireId(field, value);
    }

    public ScopeType requireScopeType(String value) {
        ScopeType type = ScopeType.fromWire(value);
        if (type == null) {
            throw CreditException.invalidRequest("unsupported scope_type: " + value);
        }
        return type;
    }

    public void requireSats(String field, long value, long max) {
        if (value <= 0) {
            throw CreditException.invalidRequest(field + " must be > 0");
        }
        if (value > max) {
            throw CreditException.invalidRequest(field + " exceeds policy cap of " + max);
        }
    }

    public void requireFeeBps(int feeBps) {
        if (feeBps < 0 || feeBps > 10_000) {
            throw CreditException.invalidRequest("fee_bps must be between 0 and 10000");
        }
    }

    /**
     * Require {@code now < exp <= now + ttl}.
     *
     * @return exp truncated to milliseconds
     */
    public Instant requireExpiry(Instant exp, Instant now, long maxTtlSeconds) {
        if (exp == null) {
            throw CreditException.invalidRequest("exp is required");
        }
        Instant normalized = exp.truncatedTo(ChronoUnit.MILLIS);
        if (!normalized.isAfter(now)) {
            throw CreditException.invalidRequest("exp must be in the future");
        }
        if (normalized.isAfter(now.plusSeconds(maxTtlSeconds))) {
            throw CreditException.invalidRequest("exp exceeds max offer ttl of " + maxTtlSeconds + "s");
        }
        return normalized;
    }
}
