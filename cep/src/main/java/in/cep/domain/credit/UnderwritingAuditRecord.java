package in.cep.domain.credit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Inputs and decision behind an offer, written once per offer for replay.
 */
public record UnderwritingAuditRecord(
    String offerId,
    String agentId,
    JsonNode auditJson,
    String auditSha256,
    Instant createdAt
) {}
