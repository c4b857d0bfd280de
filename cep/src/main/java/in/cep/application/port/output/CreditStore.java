package in.cep.application.port.output;

import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.EnvelopeStatus;
import in.cep.domain.credit.Intent;
import in.cep.domain.credit.LiquidityPayEvent;
import in.cep.domain.credit.Offer;
import in.cep.domain.credit.OfferStatus;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementWrite;
import in.cep.domain.credit.UnderwritingAuditRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of the credit protocol.
 *
 * Every create-or-get call is atomic and idempotent on the supplied fingerprint:
 * a duplicate with the same fingerprint returns the stored row untouched, a duplicate
 * with a different fingerprint fails with {@link CreditStoreException.Kind#CONFLICT}.
 * Storage failures surface as {@link CreditStoreException.Kind#DB}.
 */
public interface CreditStore {

    Intent createOrGetIntent(Intent intent, String fingerprint);

    Optional<Intent> getIntent(String intentId);

    Offer createOrGetOffer(Offer offer, String fingerprint);

    Optional<Offer> getOffer(String offerId);

    void updateOfferStatus(String offerId, OfferStatus status);

    /**
     * Write the underwriting audit for an offer. A second write for the same offer fails with CONFLICT.
     */
    void putUnderwritingAudit(UnderwritingAuditRecord record);

    Optional<UnderwritingAuditRecord> getUnderwritingAudit(String offerId);

    Envelope createOrGetEnvelope(Envelope envelope, String fingerprint);

    /**
     * Create the envelope and flip its offer from OFFERED to ACCEPTED in one atomic write.
     * If the envelope already exists with the same fingerprint it is returned unchanged.
     * Fails with CONFLICT when the offer is no longer OFFERED, and NOT_FOUND when it is missing.
     */
    Envelope createEnvelopeAcceptingOffer(Envelope envelope, String fingerprint);

    Optional<Envelope> getEnvelope(String envelopeId);

    void updateEnvelopeStatus(String envelopeId, EnvelopeStatus status);

    /**
     * Accepted envelopes of the agent whose expiry is after {@code now}.
     */
    OpenEnvelopeStats getAgentOpenEnvelopeStats(String agentId, Instant now);

    OpenEnvelopeStats getGlobalOpenEnvelopeStats(Instant now);

    /**
     * Settlements are keyed by envelope: at most one row per envelope ever exists.
     */
    SettlementWrite createOrGetSettlement(Settlement settlement, String fingerprint);

    Optional<Settlement> getSettlementByEnvelope(String envelopeId);

    /**
     * Settlements created at or after {@code since}, newest first, at most {@code limit} rows.
     */
    List<Settlement> listRecentSettlements(Instant since, int limit);

    List<Settlement> listRecentSettlementsForAgent(String agentId, Instant since, int limit);

    void putLiquidityPayEvent(LiquidityPayEvent event);

    List<LiquidityPayEvent> listRecentLiquidityPayEvents(Instant since, int limit);

    /**
     * Store a receipt under (entityKind, entityId, schema). Storing the same digest again returns
     * the stored receipt; a different digest fails with CONFLICT.
     */
    CreditReceipt putReceipt(String entityKind, String entityId, CreditReceipt receipt);

    Optional<CreditReceipt> getReceipt(String entityKind, String entityId, String schema);
}
