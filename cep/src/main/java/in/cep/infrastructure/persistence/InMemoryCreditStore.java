package in.cep.infrastructure.persistence;

import in.cep.application.port.output.CreditStore;
import in.cep.application.port.output.CreditStoreException;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Process-local CreditStore. Every method holds the store monitor, so each create-or-get is atomic.
 * Used when no database is configured and in tests.
 */
public final class InMemoryCreditStore implements CreditStore {

    private record Fingerprinted<T>(T row, String fingerprint) {}

    private final Map<String, Fingerprinted<Intent>> intents = new HashMap<>();
    private final Map<String, Fingerprinted<Offer>> offers = new HashMap<>();
    private final Map<String, Fingerprinted<Envelope>> envelopes = new HashMap<>();
    private final Map<String, Fingerprinted<Settlement>> settlementsByEnvelope = new HashMap<>();
    private final Map<String, UnderwritingAuditRecord> audits = new HashMap<>();
    private final Map<String, CreditReceipt> receipts = new HashMap<>();
    private final List<LiquidityPayEvent> payEvents = new ArrayList<>();

    @Override
    public synchronized Intent createOrGetIntent(Intent intent, String fingerprint) {
        return createOrGet(intents, intent.intentId(), intent, fingerprint, "intent");
    }

    @Override
    public synchronized Optional<Intent> getIntent(String intentId) {
        return Optional.ofNullable(intents.get(intentId)).map(Fingerprinted::row);
    }

    @Override
    public synchronized Offer createOrGetOffer(Offer offer, String fingerprint) {
        return createOrGet(offers, offer.offerId(), offer, fingerprint, "offer");
    }

    @Override
    public synchronized Optional<Offer> getOffer(String offerId) {
        return Optional.ofNullable(offers.get(offerId)).map(Fingerprinted::row);
    }

    @Override
    public synchronized void updateOfferStatus(String offerId, OfferStatus status) {
        Fingerprinted<Offer> existing = offers.get(offerId);
        if (existing == null) {
            throw CreditStoreException.notFound("offer not found: " + offerId);
        }
        offers.put(offerId, new Fingerprinted<>(existing.row().withStatus(status), existing.fingerprint()));
    }

    @Override
    public synchronized void putUnderwritingAudit(UnderwritingAuditRecord record) {
        if (audits.containsKey(record.offerId())) {
            throw CreditStoreException.conflict("underwriting audit already exists for offer " + record.offerId());
        }
        audits.put(record.offerId(), record);
    }

    @Override
    public synchronized Optional<UnderwritingAuditRecord> getUnderwritingAudit(String offerId) {
        return Optional.ofNullable(audits.get(offerId));
    }

    @Override
    public synchronized Envelope createOrGetEnvelope(Envelope envelope, String fingerprint) {
        return createOrGet(envelopes, envelope.envelopeId(), envelope, fingerprint, "envelope");
    }

    @Override
    public synchronized Envelope createEnvelopeAcceptingOffer(Envelope envelope, String fingerprint) {
        Fingerprinted<Envelope> existing = envelopes.get(envelope.envelopeId());
        if (existing != null) {
            return createOrGet(envelopes, envelope.envelopeId(), envelope, fingerprint, "envelope");
        }
        Fingerprinted<Offer> offer = offers.get(envelope.offerId());
        if (offer == null) {
            throw CreditStoreException.notFound("offer not found: " + envelope.offerId());
        }
        if (offer.row().status() != OfferStatus.OFFERED) {
            throw CreditStoreException.conflict("offer already accepted");
        }
        offers.put(envelope.offerId(), new Fingerprinted<>(offer.row().withStatus(OfferStatus.ACCEPTED), offer.fingerprint()));
        envelopes.put(envelope.envelopeId(), new Fingerprinted<>(envelope, fingerprint));
        return envelope;
    }

    @Override
    public synchronized Optional<Envelope> getEnvelope(String envelopeId) {
        return Optional.ofNullable(envelopes.get(envelopeId)).map(Fingerprinted::row);
    }

    @Override
    public synchronized void updateEnvelopeStatus(String envelopeId, EnvelopeStatus status) {
        Fingerprinted<Envelope> existing = envelopes.get(envelopeId);
        if (existing == null) {
            throw CreditStoreException.notFound("envelope not found: " + envelopeId);
        }
        envelopes.put(envelopeId, new Fingerprinted<>(existing.row().withStatus(status), existing.fingerprint()));
    }

    @Override
    public synchronized OpenEnvelopeStats getAgentOpenEnvelopeStats(String agentId, Instant now) {
        return openStats(e -> e.agentId().equals(agentId), now);
    }

    @Override
    public synchronized OpenEnvelopeStats getGlobalOpenEnvelopeStats(Instant now) {
        return openStats(e -> true, now);
    }

    private OpenEnvelopeStats openStats(Predicate<Envelope> filter, Instant now) {
        long count = 0;
        long reserved = 0;
        for (Fingerprinted<Envelope> entry : envelopes.values()) {
            Envelope envelope = entry.row();
            if (filter.test(envelope) && envelope.isOpenAt(now)) {
                count++;
                reserved += envelope.maxSats();
            }
        }
        return new OpenEnvelopeStats(count, reserved);
    }

    @Override
    public synchronized SettlementWrite createOrGetSettlement(Settlement settlement, String fingerprint) {
        Fingerprinted<Settlement> existing = settlementsByEnvelope.get(settlement.envelopeId());
        if (existing != null) {
            if (!existing.fingerprint().equals(fingerprint)) {
                throw CreditStoreException.conflict("settlement already exists for envelope with different parameters");
            }
            return new SettlementWrite(existing.row(), false);
        }
        settlementsByEnvelope.put(settlement.envelopeId(), new Fingerprinted<>(settlement, fingerprint));
        return new SettlementWrite(settlement, true);
    }

    @Override
    public synchronized Optional<Settlement> getSettlementByEnvelope(String envelopeId) {
        return Optional.ofNullable(settlementsByEnvelope.get(envelopeId)).map(Fingerprinted::row);
    }

    @Override
    public synchronized List<Settlement> listRecentSettlements(Instant since, int limit) {
        return recentSettlements(s -> true, since, limit);
    }

    @Override
    public synchronized List<Settlement> listRecentSettlementsForAgent(String agentId, Instant since, int limit) {
        return recentSettlements(s -> s.agentId().equals(agentId), since, limit);
    }

    private List<Settlement> recentSettlements(Predicate<Settlement> filter, Instant since, int limit) {
        return settlementsByEnvelope.values().stream()
            .map(Fingerprinted::row)
            .filter(filter)
            .filter(s -> !s.createdAt().isBefore(since))
            .sorted(Comparator.comparing(Settlement::createdAt).reversed())
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void putLiquidityPayEvent(LiquidityPayEvent event) {
        payEvents.add(event);
    }

    @Override
    public synchronized List<LiquidityPayEvent> listRecentLiquidityPayEvents(Instant since, int limit) {
        return payEvents.stream()
            .filter(e -> !e.createdAt().isBefore(since))
            .sorted(Comparator.comparing(LiquidityPayEvent::createdAt).reversed())
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized CreditReceipt putReceipt(String entityKind, String entityId, CreditReceipt receipt) {
        String key = receiptKey(entityKind, entityId, receipt.schema());
        CreditReceipt existing = receipts.get(key);
        if (existing != null) {
            if (!existing.canonicalJsonSha256().equals(receipt.canonicalJsonSha256())) {
                throw CreditStoreException.conflict("receipt already exists for " + entityKind + " " + entityId
                    + " with a different digest");
            }
            return existing;
        }
        receipts.put(key, receipt);
        return receipt;
    }

    @Override
    public synchronized Optional<CreditReceipt> getReceipt(String entityKind, String entityId, String schema) {
        return Optional.ofNullable(receipts.get(receiptKey(entityKind, entityId, schema)));
    }

    private static String receiptKey(String entityKind, String entityId, String schema) {
        return entityKind + "|" + entityId + "|" + schema;
    }

    private static <T> T createOrGet(Map<String, Fingerprinted<T>> table, String id, T row,
                                     String fingerprint, String kind) {
        Fingerprinted<T> existing = table.get(id);
        if (existing != null) {
            if (!existing.fingerprint().equals(fingerprint)) {
                throw CreditStoreException.conflict(kind + " " + id + " already exists with different parameters");
            }
            return existing.row();
        }
        table.put(id, new Fingerprinted<>(row, fingerprint));
        return row;
    }
}
