package in.cep.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.cep.domain.credit.AttestationEvent;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.EnvelopeStatus;
import in.cep.domain.credit.ReceiptSignature;
import in.cep.domain.credit.ScopeType;
import in.cep.security.CanonicalJson;
import in.cep.security.ReceiptSigner;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AttestationLabelerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Envelope envelope = new Envelope("cepe_abc", "cepo_abc", "agent-1", "pool-1", "provider-1",
        ScopeType.NIP90, "job-42", 400, 50, NOW.plusSeconds(600), EnvelopeStatus.ACCEPTED, NOW);

    @Test
    void build_returnsEmptyWithoutSigningKey() {
        assertTrue(new AttestationLabeler(ReceiptSigner.unsigned()).build(true, envelope, NOW).isEmpty());
    }

    @Test
    void build_labelsOutcomeAndTargetsParties() {
        ReceiptSigner signer = ReceiptSigner.of(ReceiptSigner.generateKeyPair());

        AttestationEvent event = new AttestationLabeler(signer).build(false, envelope, NOW).orElseThrow();
        JsonNode body = event.event();

        assertEquals("default", event.label());
        assertEquals(AttestationLabeler.KIND_LABEL, body.get("kind").asInt());
        assertEquals(NOW.getEpochSecond(), body.get("created_at").asLong());
        assertEquals("envelope=cepe_abc scope=job-42", body.get("content").asText());
        assertEquals(CanonicalJson.fingerprint(body), event.eventSha256());

        JsonNode tags = body.get("tags");
        assertEquals("l", tags.get(1).get(0).asText());
        assertEquals("default", tags.get(1).get(1).asText());
        assertEquals("agent-1", tags.get(2).get(1).asText());
        assertEquals("provider-1", tags.get(3).get(1).asText());
        assertEquals("openagents.credit:scope:job-42", tags.get(4).get(1).asText());
    }

    @Test
    void build_signatureCoversEventId() {
        ReceiptSigner signer = ReceiptSigner.of(ReceiptSigner.generateKeyPair());

        AttestationEvent event = new AttestationLabeler(signer).build(true, envelope, NOW).orElseThrow();

        ReceiptSignature signature = new ReceiptSignature(ReceiptSigner.SCHEME, signer.publicKeyB64(),
            event.eventId(), event.signature());
        assertTrue(ReceiptSigner.verify(signature));
        assertEquals("success", event.label());
    }
}
