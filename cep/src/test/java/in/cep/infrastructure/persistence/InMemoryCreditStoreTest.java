package in.cep.infrastructure.persistence;

import in.cep.application.port.output.CreditStoreException;
import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.EnvelopeStatus;
import in.cep.domain.credit.Offer;
import in.cep.domain.credit.OfferStatus;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.ScopeType;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;
import in.cep.domain.credit.SettlementWrite;
import in.cep.domain.credit.UnderwritingAuditRecord;
import in.cep.security.CanonicalJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Credit Store Tests")
class InMemoryCreditStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryCreditStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCreditStore();
    }

    @Test
    void createOrGetOffer_sameFingerprintReturnsStoredRow() {
        Offer stored = store.createOrGetOffer(offer("cepo_1", 400), "fp-a");
        Offer again = store.createOrGetOffer(offer("cepo_1", 999), "fp-a");

        assertEquals(stored, again);
        assertEquals(400, again.maxSats());
    }

    @Test
    void createOrGetOffer_differentFingerprintConflicts() {
        store.createOrGetOffer(offer("cepo_1", 400), "fp-a");

        CreditStoreException e = assertThrows(CreditStoreException.class,
            () -> store.createOrGetOffer(offer("cepo_1", 400), "fp-b"));

        assertEquals(CreditStoreException.Kind.CONFLICT, e.getKind());
    }

    @Test
    void createEnvelopeAcceptingOffer_flipsOfferOnce() {
        store.createOrGetOffer(offer("cepo_1", 400), "fp-o");

        Envelope first = store.createEnvelopeAcceptingOffer(envelope("cepe_1", "cepo_1", "provider-1"), "fp-e1");

        assertEquals(OfferStatus.ACCEPTED, store.getOffer("cepo_1").orElseThrow().status());
        // Replaying the same envelope is fine
        assertEquals(first, store.createEnvelopeAcceptingOffer(envelope("cepe_1", "cepo_1", "provider-1"), "fp-e1"));

        CreditStoreException e = assertThrows(CreditStoreException.class,
            () -> store.createEnvelopeAcceptingOffer(envelope("cepe_2", "cepo_1", "provider-2"), "fp-e2"));
        assertEquals(CreditStoreException.Kind.CONFLICT, e.getKind());
        assertTrue(store.getEnvelope("cepe_2").isEmpty());
    }

    @Test
    void createEnvelopeAcceptingOffer_missingOfferIsNotFound() {
        CreditStoreException e = assertThrows(CreditStoreException.class,
            () -> store.createEnvelopeAcceptingOffer(envelope("cepe_1", "cepo_missing", "provider-1"), "fp"));

        assertEquals(CreditStoreException.Kind.NOT_FOUND, e.getKind());
    }

    @Test
    void createEnvelopeAcceptingOffer_concurrentProvidersOnlyOneWins() throws Exception {
        store.createOrGetOffer(offer("cepo_1", 400), "fp-o");
        int racers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < racers; i++) {
                String id = "cepe_" + i;
                String provider = "provider-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.createEnvelopeAcceptingOffer(envelope(id, "cepo_1", provider), "fp-" + id);
                        return true;
                    } catch (CreditStoreException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void openEnvelopeStats_countOnlyAcceptedAndUnexpired() {
        store.createOrGetEnvelope(envelope("cepe_1", "cepo_1", "p"), "fp1");
        store.createOrGetEnvelope(envelope("cepe_2", "cepo_2", "p"), "fp2");
        store.createOrGetEnvelope(envelope("cepe_3", "cepo_3", "p"), "fp3");
        store.updateEnvelopeStatus("cepe_3", EnvelopeStatus.SETTLED);

        assertEquals(new OpenEnvelopeStats(2, 800), store.getAgentOpenEnvelopeStats("agent-1", NOW));
        assertEquals(new OpenEnvelopeStats(0, 0), store.getAgentOpenEnvelopeStats("agent-2", NOW));
        // Expired envelopes stop reserving
        assertEquals(new OpenEnvelopeStats(0, 0), store.getGlobalOpenEnvelopeStats(NOW.plusSeconds(600)));
    }

    @Test
    void createOrGetSettlement_isKeyedByEnvelope() {
        SettlementWrite first = store.createOrGetSettlement(settlement("ceps_1", "cepe_1", NOW), "fp-s1");
        SettlementWrite replay = store.createOrGetSettlement(settlement("ceps_1", "cepe_1", NOW), "fp-s1");

        assertTrue(first.created());
        assertFalse(replay.created());
        assertEquals(first.settlement(), replay.settlement());

        CreditStoreException e = assertThrows(CreditStoreException.class,
            () -> store.createOrGetSettlement(settlement("ceps_2", "cepe_1", NOW), "fp-s2"));
        assertEquals(CreditStoreException.Kind.CONFLICT, e.getKind());
        assertEquals("settlement already exists for envelope with different parameters", e.getMessage());
    }

    @Test
    void listRecentSettlements_newestFirstWithinWindowAndLimit() {
        store.createOrGetSettlement(settlement("ceps_1", "cepe_1", NOW.minusSeconds(300)), "a");
        store.createOrGetSettlement(settlement("ceps_2", "cepe_2", NOW.minusSeconds(100)), "b");
        store.createOrGetSettlement(settlement("ceps_3", "cepe_3", NOW.minusSeconds(200)), "c");
        store.createOrGetSettlement(settlement("ceps_4", "cepe_4", NOW.minusSeconds(9_000)), "d");

        List<Settlement> recent = store.listRecentSettlements(NOW.minusSeconds(3_600), 2);

        assertEquals(2, recent.size());
        assertEquals("ceps_2", recent.get(0).settlementId());
        assertEquals("ceps_3", recent.get(1).settlementId());
    }

    @Test
    void putReceipt_sameDigestIsIdempotentDifferentDigestConflicts() {
        CreditReceipt receipt = receipt("ceir_1", "digest-a");

        assertEquals(receipt, store.putReceipt("envelope", "cepe_1", receipt));
        assertEquals(receipt, store.putReceipt("envelope", "cepe_1", receipt("ceir_1", "digest-a")));
        assertThrows(CreditStoreException.class,
            () -> store.putReceipt("envelope", "cepe_1", receipt("ceir_2", "digest-b")));
        assertTrue(store.getReceipt("envelope", "cepe_1", "schema.v1").isPresent());
    }

    @Test
    void putUnderwritingAudit_writesOnce() {
        UnderwritingAuditRecord record = new UnderwritingAuditRecord("cepo_1", "agent-1",
            CanonicalJson.object(), "sha", NOW);

        store.putUnderwritingAudit(record);

        assertEquals(record, store.getUnderwritingAudit("cepo_1").orElseThrow());
        assertThrows(CreditStoreException.class, () -> store.putUnderwritingAudit(record));
    }

    private static Offer offer(String offerId, long maxSats) {
        return new Offer(offerId, "agent-1", "pool-1", null, ScopeType.NIP90, "job-42", maxSats, 50, true,
            NOW.plusSeconds(600), OfferStatus.OFFERED, NOW);
    }

    private static Envelope envelope(String envelopeId, String offerId, String providerId) {
        return new Envelope(envelopeId, offerId, "agent-1", "pool-1", providerId, ScopeType.NIP90, "job-42",
            400, 50, NOW.plusSeconds(600), EnvelopeStatus.ACCEPTED, NOW);
    }

    private static Settlement settlement(String settlementId, String envelopeId, Instant createdAt) {
        return new Settlement(settlementId, envelopeId, "agent-1", "pool-1", "provider-1",
            SettlementOutcome.SUCCESS, 300, 2, true, "vsha", "lsha", createdAt);
    }

    private static CreditReceipt receipt(String receiptId, String digest) {
        return new CreditReceipt(receiptId, "schema.v1", digest, null, CanonicalJson.object(), NOW);
    }
}
