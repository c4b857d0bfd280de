package in.cep.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Audit trail for credit state transitions, with sensitive values masked.
 *
 * One line per transition in the form {@code [component][TAG] key=value, ...}.
 * Lightning invoices, signing key material and bearer tokens never reach the log verbatim.
 *
 * Usage:
 * <pre>
 * CreditAuditLogger audit = new CreditAuditLogger("CEP");
 * audit.logEnvelopeIssued("cepe_...", "cepo_...", "agent-1", "provider-1", 400);
 * audit.logError("settle", "pay failed for lnbc3000n1p...");   // invoice masked
 * </pre>
 */
public class CreditAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(CreditAuditLogger.class);

    private final String component;

    private static final Pattern INVOICE_PATTERN =
        Pattern.compile("\\b(ln(?:bcrt|bc|tbs|tb|sb))[0-9a-z]{8,}\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern KEY_PATTERN =
        Pattern.compile("((?:private|signing)[_-]?key|secret|token|password)=[^&\\s,]+", Pattern.CASE_INSENSITIVE);

    public CreditAuditLogger(String component) {
        this.component = component;
    }

    public void logIntent(String intentId, String agentId, long maxSats) {
        log.info("[{}][INTENT] intent_id={}, agent_id={}, max_sats={}, timestamp={}",
            component, intentId, agentId, maxSats, Instant.now());
    }

    public void logOffer(String offerId, String agentId, long requestedSats, long grantedSats, int feeBps) {
        log.info("[{}][OFFER] offer_id={}, agent_id={}, requested_sats={}, granted_sats={}, fee_bps={}, timestamp={}",
            component, offerId, agentId, requestedSats, grantedSats, feeBps, Instant.now());
    }

    public void logEnvelopeIssued(String envelopeId, String offerId, String agentId, String providerId, long maxSats) {
        log.info("[{}][ENVELOPE] envelope_id={}, offer_id={}, agent_id={}, provider_id={}, max_sats={}, timestamp={}",
            component, envelopeId, offerId, agentId, providerId, maxSats, Instant.now());
    }

    public void logSettlement(String settlementId, String envelopeId, String outcome, long spentSats, long feeSats) {
        log.info("[{}][SETTLEMENT] settlement_id={}, envelope_id={}, outcome={}, spent_sats={}, fee_sats={}, timestamp={}",
            component, settlementId, envelopeId, outcome, spentSats, feeSats, Instant.now());
    }

    public void logDefault(String settlementId, String envelopeId, String reason) {
        log.warn("[{}][DEFAULT] settlement_id={}, envelope_id={}, reason={}, timestamp={}",
            component, settlementId, envelopeId, reason, Instant.now());
    }

    public void logPayment(String envelopeId, String quoteId, String status, String host) {
        log.info("[{}][PAYMENT] envelope_id={}, quote_id={}, status={}, host={}, timestamp={}",
            component, envelopeId, quoteId, status, host, Instant.now());
    }

    public void logBreaker(String breaker, String detail) {
        log.warn("[{}][BREAKER] breaker={}, detail={}, timestamp={}",
            component, breaker, sanitize(detail), Instant.now());
    }

    /**
     * @param error error message (will be sanitized)
     */
    public void logError(String operation, String error) {
        log.error("[{}][ERROR] operation={}, error={}, timestamp={}",
            component, operation, sanitize(error), Instant.now());
    }

    /**
     * Mask invoices, bearer tokens and key material.
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String result = INVOICE_PATTERN.matcher(input).replaceAll("$1****");
        result = BEARER_TOKEN_PATTERN.matcher(result).replaceAll("Bearer ****");
        result = KEY_PATTERN.matcher(result).replaceAll("$1=****");
        return result;
    }

    /**
     * Short, non-reversible form of an invoice for log correlation.
     */
    public String maskInvoice(String invoice) {
        if (invoice == null || invoice.isBlank()) {
            return invoice;
        }
        String trimmed = invoice.trim();
        if (trimmed.length() <= 12) {
            return "****";
        }
        return trimmed.substring(0, 8) + "****" + trimmed.substring(trimmed.length() - 4);
    }
}
