package in.cep.domain.credit;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signed public label event pointing at a settlement outcome.
 */
public record AttestationEvent(
    String eventId,
    String eventSha256,
    String label,
    JsonNode event,
    String signature
) {}
