package in.cep.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.cep.domain.credit.AttestationEvent;
import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.CreditSchemas;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.ReceiptSignature;
import in.cep.domain.credit.Settlement;
import in.cep.security.CanonicalJson;
import in.cep.security.ReceiptSigner;

import java.time.Instant;

/**
 * Builds hash-addressed receipts for envelope issue, settlement and default.
 *
 * The digest covers every payload field; receipt ids are the digest prefix
 * ({@code ceir_}, {@code cesr_}, {@code cedn_}).
 */
public final class CreditReceiptFactory {

    private final ReceiptSigner signer;

    public CreditReceiptFactory(ReceiptSigner signer) {
        this.signer = signer;
    }

    public CreditReceipt envelopeIssue(Envelope envelope) {
        ObjectNode payload = CanonicalJson.object();
        payload.put("schema", CreditSchemas.ENVELOPE_ISSUE_RECEIPT);
        payload.put("offer_id", envelope.offerId());
        payload.put("envelope_id", envelope.envelopeId());
        putParties(payload, envelope);
        payload.put("max_sats", envelope.maxSats());
        payload.put("fee_bps", envelope.feeBps());
        payload.put("exp", envelope.exp().toString());
        payload.put("issued_at", envelope.issuedAt().toString());
        return seal("ceir", CreditSchemas.ENVELOPE_ISSUE_RECEIPT, payload, envelope.issuedAt());
    }

    /**
     * @param label optional public label event; its id and digest are committed to by the receipt
     */
    public CreditReceipt settlement(Settlement settlement, Envelope envelope, AttestationEvent label) {
        ObjectNode payload = CanonicalJson.object();
        payload.put("schema", CreditSchemas.ENVELOPE_SETTLEMENT_RECEIPT);
        payload.put("settlement_id", settlement.settlementId());
        payload.put("envelope_id", envelope.envelopeId());
        putParties(payload, envelope);
        payload.put("outcome", settlement.outcome().wireValue());
        payload.put("spent_sats", settlement.spentSats());
        payload.put("fee_sats", settlement.feeSats());
        payload.put("verification_receipt_sha256", settlement.verificationReceiptSha256());
        payload.put("liquidity_receipt_sha256", settlement.liquidityReceiptSha256());
        putLabel(payload, label);
        payload.put("created_at", settlement.createdAt().toString());
        return seal("cesr", CreditSchemas.ENVELOPE_SETTLEMENT_RECEIPT, payload, settlement.createdAt());
    }

    /**
     * Default notice for an expired or verification-failed envelope. Loss is always zero:
     * nothing was paid out of the pool.
     */
    public CreditReceipt defaultNotice(Settlement settlement, Envelope envelope, String reason, AttestationEvent label) {
        ObjectNode payload = CanonicalJson.object();
        payload.put("schema", CreditSchemas.DEFAULT_NOTICE);
        payload.put("settlement_id", settlement.settlementId());
        payload.put("envelope_id", envelope.envelopeId());
        putParties(payload, envelope);
        payload.put("reason", reason);
        payload.put("loss_sats", 0L);
        payload.put("verification_receipt_sha256", settlement.verificationReceiptSha256());
        putLabel(payload, label);
        payload.put("created_at", settlement.createdAt().toString());
        return seal("cedn", CreditSchemas.DEFAULT_NOTICE, payload, settlement.createdAt());
    }

    /**
     * Re-hash the payload and check the signature, if any.
     */
    public static boolean verify(CreditReceipt receipt) {
        String digest = CanonicalJson.fingerprint(receipt.payload());
        if (!digest.equals(receipt.canonicalJsonSha256())) {
            return false;
        }
        ReceiptSignature signature = receipt.signature();
        if (signature == null) {
            return true;
        }
        return digest.equals(signature.signedSha256()) && ReceiptSigner.verify(signature);
    }

    private CreditReceipt seal(String prefix, String schema, JsonNode payload, Instant createdAt) {
        String digest = CanonicalJson.fingerprint(payload);
        ReceiptSignature signature = signer.sign(digest).orElse(null);
        return new CreditReceipt(CanonicalJson.entityId(prefix, digest), schema, digest, signature, payload, createdAt);
    }

    private static void putParties(ObjectNode payload, Envelope envelope) {
        payload.put("agent_id", envelope.agentId());
        payload.put("pool_id", envelope.poolId());
        payload.put("provider_id", envelope.providerId());
        payload.put("scope_type", envelope.scopeType().wireValue());
        payload.put("scope_id", envelope.scopeId());
    }

    private static void putLabel(ObjectNode payload, AttestationEvent label) {
        if (label != null) {
            payload.put("label_event_id", label.eventId());
            payload.put("label_event_sha256", label.eventSha256());
            payload.set("label_event", label.event());
        }
    }
}
