package in.cep.application.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.cep.domain.credit.AttestationEvent;
import in.cep.domain.credit.Envelope;
import in.cep.security.CanonicalJson;
import in.cep.security.ReceiptSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Builds the public label event attached to settlement and default receipts.
 *
 * Kind 1985 label in namespace {@code openagents.credit}, value {@code success} or {@code default},
 * targeting the agent, the provider and the envelope scope topic. Only built when a signing key is
 * configured; any failure yields no event rather than failing the settlement.
 */
public final class AttestationLabeler {
    private static final Logger log = LoggerFactory.getLogger(AttestationLabeler.class);

    public static final int KIND_LABEL = 1985;
    public static final String NAMESPACE = "openagents.credit";

    private final ReceiptSigner signer;

    public AttestationLabeler(ReceiptSigner signer) {
        this.signer = signer;
    }

    public Optional<AttestationEvent> build(boolean success, Envelope envelope, Instant now) {
        if (!signer.isEnabled()) {
            return Optional.empty();
        }
        String label = success ? "success" : "default";
        try {
            long createdAt = Math.max(now.getEpochSecond(), 0);
            String content = "envelope=" + envelope.envelopeId() + " scope=" + envelope.scopeId();

            ArrayNode tags = CanonicalJson.mapper().createArrayNode();
            tags.addArray().add("L").add(NAMESPACE);
            tags.addArray().add("l").add(label).add(NAMESPACE);
            tags.addArray().add("p").add(envelope.agentId());
            tags.addArray().add("p").add(envelope.providerId());
            tags.addArray().add("t").add(NAMESPACE + ":scope:" + envelope.scopeId());

            // Event id commits to [0, pubkey, created_at, kind, tags, content]
            ArrayNode commitment = CanonicalJson.mapper().createArrayNode();
            commitment.add(0).add(signer.publicKeyB64()).add(createdAt).add(KIND_LABEL).add(tags).add(content);
            String eventId = CanonicalJson.fingerprint(commitment);
            String sig = signer.signB64(eventId);

            ObjectNode event = CanonicalJson.object();
            event.put("id", eventId);
            event.put("pubkey", signer.publicKeyB64());
            event.put("created_at", createdAt);
            event.put("kind", KIND_LABEL);
            event.set("tags", tags);
            event.put("content", content);
            event.put("sig", sig);

            return Optional.of(new AttestationEvent(eventId, CanonicalJson.fingerprint(event), label, event, sig));
        } catch (RuntimeException e) {
            log.warn("[CEP] label event build failed for envelope {}: {}", envelope.envelopeId(), e.getMessage());
            return Optional.empty();
        }
    }
}
