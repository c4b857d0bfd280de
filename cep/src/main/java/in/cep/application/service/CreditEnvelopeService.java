package in.cep.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.cep.application.port.output.AttestationPublisher;
import in.cep.application.port.output.CreditStore;
import in.cep.application.port.output.CreditStoreException;
import in.cep.application.port.output.InvoiceAmountDecoder;
import in.cep.application.port.output.LiquidityPayments;
import in.cep.config.CreditPolicyConfig;
import in.cep.domain.common.CreditErrorCode;
import in.cep.domain.common.CreditException;
import in.cep.domain.credit.AttestationEvent;
import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.CreditSchemas;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.EnvelopeStatus;
import in.cep.domain.credit.Intent;
import in.cep.domain.credit.Offer;
import in.cep.domain.credit.OfferStatus;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.ScopeType;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;
import in.cep.domain.credit.SettlementWrite;
import in.cep.domain.credit.UnderwritingAuditRecord;
import in.cep.domain.credit.UnderwritingDecision;
import in.cep.domain.credit.UnderwritingStats;
import in.cep.domain.liquidity.PayResult;
import in.cep.domain.protocol.AgentExposure;
import in.cep.domain.protocol.EnvelopeRequest;
import in.cep.domain.protocol.EnvelopeResponse;
import in.cep.domain.protocol.HealthReport;
import in.cep.domain.protocol.IntentRequest;
import in.cep.domain.protocol.IntentResponse;
import in.cep.domain.protocol.OfferRequest;
import in.cep.domain.protocol.OfferResponse;
import in.cep.domain.protocol.OfferTerms;
import in.cep.domain.protocol.SettleRequest;
import in.cep.domain.protocol.SettleResponse;
import in.cep.infrastructure.metrics.CreditMetrics;
import in.cep.security.CanonicalJson;
import in.cep.security.CreditAuditLogger;
import in.cep.security.CreditRequestValidator;
import in.cep.security.ReceiptSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Credit Envelope Protocol engine: Intent -> Offer -> Envelope -> Settlement.
 *
 * Every operation runs as a short task on the supplied executor and completes its future with the
 * persisted entity, or exceptionally with a {@link CreditException}. The engine keeps no state between
 * calls; the store's fingerprint-keyed create-or-get writes are what make concurrent duplicates safe.
 *
 * Settlement is keyed by envelope, not by request: once an envelope has a settlement, every later
 * settle call returns that stored outcome and receipt, whatever it asks for.
 */
public final class CreditEnvelopeService {
    private static final Logger log = LoggerFactory.getLogger(CreditEnvelopeService.class);

    private final CreditStore store;
    private final AttestationPublisher attestations;
    private final InvoiceAmountDecoder invoices;
    private final CreditPolicyConfig policy;
    private final CreditMetrics metrics;
    private final Clock clock;
    private final Executor executor;

    private final UnderwritingEngine underwriting;
    private final CreditHealthMonitor healthMonitor;
    private final CreditReceiptFactory receipts;
    private final AttestationLabeler labeler;
    private final SettlementPaymentStep paymentStep;
    private final CreditRequestValidator validator;
    private final CreditAuditLogger audit;

    public CreditEnvelopeService(
        CreditStore store,
        LiquidityPayments payments,
        AttestationPublisher attestations,
        InvoiceAmountDecoder invoices,
        ReceiptSigner signer,
        CreditPolicyConfig policy,
        CreditMetrics metrics,
        Clock clock,
        Executor executor
    ) {
        this.store = store;
        this.attestations = attestations;
        this.invoices = invoices;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;

        this.audit = new CreditAuditLogger("CEP");
        this.validator = new CreditRequestValidator();
        this.underwriting = new UnderwritingEngine(store, policy);
        this.healthMonitor = new CreditHealthMonitor(store, policy, metrics);
        this.receipts = new CreditReceiptFactory(signer);
        this.labeler = new AttestationLabeler(signer);
        this.paymentStep = new SettlementPaymentStep(payments, store, metrics, audit);
    }

    public CompletableFuture<IntentResponse> intent(IntentRequest request) {
        return run("intent", () -> doIntent(request));
    }

    public CompletableFuture<OfferResponse> offer(OfferRequest request) {
        return run("offer", () -> doOffer(request));
    }

    public CompletableFuture<EnvelopeResponse> envelope(EnvelopeRequest request) {
        return run("envelope", () -> doEnvelope(request));
    }

    public CompletableFuture<SettleResponse> settle(SettleRequest request) {
        return run("settle", () -> doSettle(request));
    }

    public CompletableFuture<HealthReport> health() {
        return run("health", () -> healthMonitor.evaluate(clock.instant()));
    }

    public CompletableFuture<AgentExposure> agentExposure(String agentId) {
        return run("agent_exposure", () -> doAgentExposure(agentId));
    }

    public CreditPolicyConfig policy() {
        return policy;
    }

    // ═══════════════════════════════════════════════════════════════
    // Intent
    // ═══════════════════════════════════════════════════════════════

    private IntentResponse doIntent(IntentRequest request) {
        Instant now = clock.instant();
        validator.requireSchema(request.schema(), CreditSchemas.INTENT_REQUEST);
        String idempotencyKey = validator.requireId("idempotency_key", request.idempotencyKey());
        String agentId = validator.requireId("agent_id", request.agentId());
        ScopeType scopeType = validator.requireScopeType(request.scopeType());
        String scopeId = validator.requireId("scope_id", request.scopeId());
        validator.requireSats("max_sats", request.maxSats(), policy.maxSatsPerEnvelope());
        Instant exp = validator.requireExpiry(request.exp(), now, policy.maxOfferTtlSeconds());

        JsonNode policyContext = request.policyContext() == null || request.policyContext().isNull()
            ? CanonicalJson.object()
            : request.policyContext();

        ObjectNode fp = CanonicalJson.object();
        fp.put("schema", CreditSchemas.INTENT_REQUEST);
        fp.put("idempotency_key", idempotencyKey);
        fp.put("agent_id", agentId);
        fp.put("scope_type", scopeType.wireValue());
        fp.put("scope_id", scopeId);
        fp.put("max_sats", request.maxSats());
        fp.put("exp", exp.toString());
        fp.put("policy_context_sha256", CanonicalJson.fingerprint(policyContext));
        String fingerprint = CanonicalJson.fingerprint(fp);

        String intentId = CanonicalJson.entityId("cepi", CanonicalJson.sha256Hex(idempotencyKey));
        Intent stored = store.createOrGetIntent(new Intent(
            intentId, idempotencyKey, agentId, scopeType, scopeId, request.maxSats(), exp, policyContext, now),
            fingerprint);

        audit.logIntent(stored.intentId(), stored.agentId(), stored.maxSats());
        return new IntentResponse(CreditSchemas.INTENT_RESPONSE, stored);
    }

    // ═══════════════════════════════════════════════════════════════
    // Offer
    // ═══════════════════════════════════════════════════════════════

    private OfferResponse doOffer(OfferRequest request) {
        Instant now = clock.instant();
        validator.requireSchema(request.schema(), CreditSchemas.OFFER_REQUEST);
        String agentId = validator.requireId("agent_id", request.agentId());
        String poolId = validator.requireId("pool_id", request.poolId());
        String intentId = validator.optionalId("intent_id", request.intentId());
        ScopeType scopeType = validator.requireScopeType(request.scopeType());
        String scopeId = validator.requireId("scope_id", request.scopeId());
        validator.requireSats("max_sats", request.maxSats(), policy.maxSatsPerEnvelope());
        validator.requireFeeBps(request.feeBps());
        Instant exp = validator.requireExpiry(request.exp(), now, policy.maxOfferTtlSeconds());

        if (intentId != null) {
            Intent intent = store.getIntent(intentId)
                .orElseThrow(() -> CreditException.notFound("intent not found"));
            requireWithinIntent(intent, agentId, scopeType, scopeId, request.maxSats(), exp);
        }

        UnderwritingDecision decision = underwriting.evaluate(agentId, now);
        OfferTerms requested = new OfferTerms(request.maxSats(), request.feeBps(), request.requiresVerifier());
        long grantedSats = Math.max(Math.min(request.maxSats(), decision.limitSats()), 1);

        ObjectNode fp = CanonicalJson.object();
        fp.put("schema", CreditSchemas.OFFER_REQUEST);
        fp.put("intent_id", intentId);
        fp.put("agent_id", agentId);
        fp.put("pool_id", poolId);
        fp.put("scope_type", scopeType.wireValue());
        fp.put("scope_id", scopeId);
        fp.put("max_sats", request.maxSats());
        fp.put("fee_bps", request.feeBps());
        fp.put("requires_verifier", request.requiresVerifier());
        fp.put("exp", exp.toString());
        String fingerprint = CanonicalJson.fingerprint(fp);
        String offerId = CanonicalJson.entityId("cepo", fingerprint);

        Offer stored = store.createOrGetOffer(new Offer(
            offerId, agentId, poolId, intentId, scopeType, scopeId,
            grantedSats, decision.feeBps(), decision.requiresVerifier(),
            exp, OfferStatus.OFFERED, now), fingerprint);

        putUnderwritingAudit(stored, decision, now);

        OfferTerms granted = new OfferTerms(stored.maxSats(), stored.feeBps(), stored.requiresVerifier());
        audit.logOffer(stored.offerId(), agentId, request.maxSats(), stored.maxSats(), stored.feeBps());
        return new OfferResponse(CreditSchemas.OFFER_RESPONSE, stored, requested, granted, decision.riskScore());
    }

    private static void requireWithinIntent(Intent intent, String agentId, ScopeType scopeType, String scopeId,
                                            long maxSats, Instant exp) {
        if (!intent.agentId().equals(agentId)) {
            throw CreditException.conflict("intent mismatch: agent_id differs");
        }
        if (intent.scopeType() != scopeType || !intent.scopeId().equals(scopeId)) {
            throw CreditException.conflict("intent mismatch: scope differs");
        }
        if (maxSats > intent.maxSats()) {
            throw CreditException.conflict("intent mismatch: max_sats exceeds intent");
        }
        if (exp.isAfter(intent.exp())) {
            throw CreditException.conflict("intent mismatch: exp exceeds intent");
        }
    }

    private void putUnderwritingAudit(Offer offer, UnderwritingDecision decision, Instant now) {
        ObjectNode auditJson = CanonicalJson.object();
        auditJson.put("schema", CreditSchemas.UNDERWRITING_AUDIT);
        auditJson.put("offerId", offer.offerId());
        auditJson.put("intentId", offer.intentId());
        auditJson.put("issuedAt", offer.issuedAt().toString());
        auditJson.set("inputs", decision.auditInputs());
        ObjectNode decisionNode = auditJson.putObject("decision");
        decisionNode.put("limitSats", decision.limitSats());
        decisionNode.put("feeBps", decision.feeBps());
        decisionNode.put("requiresVerifier", decision.requiresVerifier());
        decisionNode.put("riskScore", decision.riskScore());

        try {
            store.putUnderwritingAudit(new UnderwritingAuditRecord(
                offer.offerId(), offer.agentId(), auditJson, CanonicalJson.fingerprint(auditJson), now));
        } catch (CreditStoreException e) {
            if (e.getKind() != CreditStoreException.Kind.CONFLICT) {
                throw e;
            }
            log.debug("[CEP] underwriting audit already recorded for offer {}", offer.offerId());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Envelope
    // ═══════════════════════════════════════════════════════════════

    private EnvelopeResponse doEnvelope(EnvelopeRequest request) {
        Instant now = clock.instant();
        validator.requireSchema(request.schema(), CreditSchemas.ENVELOPE_REQUEST);
        String offerId = validator.requireId("offer_id", request.offerId());
        String providerId = validator.requireId("provider_id", request.providerId());

        ObjectNode fp = CanonicalJson.object();
        fp.put("schema", CreditSchemas.ENVELOPE_REQUEST);
        fp.put("offer_id", offerId);
        fp.put("provider_id", providerId);
        String fingerprint = CanonicalJson.fingerprint(fp);
        String envelopeId = CanonicalJson.entityId("cepe", fingerprint);

        // Same (offer, provider) again: hand back what was issued.
        Optional<Envelope> existing = store.getEnvelope(envelopeId);
        if (existing.isPresent()) {
            return envelopeResponse(existing.get());
        }

        Offer offer = store.getOffer(offerId)
            .orElseThrow(() -> CreditException.notFound("offer not found"));
        if (offer.status() != OfferStatus.OFFERED) {
            throw CreditException.conflict("offer is not in offered state");
        }
        if (!offer.exp().isAfter(now)) {
            throw CreditException.invalidRequest("offer expired");
        }
        if (!offer.requiresVerifier()) {
            throw CreditException.invalidRequest("offer must require a verifier");
        }
        if (offer.maxSats() > policy.maxSatsPerEnvelope()) {
            throw CreditException.invalidRequest("offer max_sats exceeds policy cap");
        }

        HealthReport health = healthMonitor.evaluate(now);
        if (health.breakers().haltNewEnvelopes()) {
            audit.logBreaker("halt_new_envelopes", "loss_rate=" + health.lossRate() + " sample=" + health.settlementSample());
            throw CreditException.dependencyUnavailable("credit circuit breaker: new envelopes halted");
        }

        OpenEnvelopeStats open = store.getAgentOpenEnvelopeStats(offer.agentId(), now);
        if (open.count() >= policy.maxOutstandingEnvelopesPerAgent()) {
            throw CreditException.conflict("max outstanding envelopes exceeded");
        }

        Envelope candidate = new Envelope(
            envelopeId, offer.offerId(), offer.agentId(), offer.poolId(), providerId,
            offer.scopeType(), offer.scopeId(), offer.maxSats(), offer.feeBps(), offer.exp(),
            EnvelopeStatus.ACCEPTED, now);

        Envelope stored;
        if (policy.exclusiveOfferAcceptance()) {
            stored = store.createEnvelopeAcceptingOffer(candidate, fingerprint);
        } else {
            stored = store.createOrGetEnvelope(candidate, fingerprint);
            markOfferAccepted(offer.offerId());
        }

        metrics.recordEnvelopeIssued(stored.maxSats());
        audit.logEnvelopeIssued(stored.envelopeId(), stored.offerId(), stored.agentId(), stored.providerId(), stored.maxSats());
        return envelopeResponse(stored);
    }

    private void markOfferAccepted(String offerId) {
        try {
            store.updateOfferStatus(offerId, OfferStatus.ACCEPTED);
        } catch (RuntimeException e) {
            log.warn("[CEP] failed to mark offer {} accepted: {}", offerId, e.getMessage());
        }
    }

    private EnvelopeResponse envelopeResponse(Envelope envelope) {
        CreditReceipt receipt = store.putReceipt(
            CreditSchemas.ENTITY_ENVELOPE, envelope.envelopeId(), receipts.envelopeIssue(envelope));
        return new EnvelopeResponse(CreditSchemas.ENVELOPE_RESPONSE, envelope, receipt);
    }

    // ═══════════════════════════════════════════════════════════════
    // Settle
    // ═══════════════════════════════════════════════════════════════

    private SettleResponse doSettle(SettleRequest request) {
        Instant now = clock.instant();
        validator.requireSchema(request.schema(), CreditSchemas.SETTLE_REQUEST);
        String envelopeId = validator.requireId("envelope_id", request.envelopeId());
        String verificationSha = validator.requireId("verification_receipt_sha256", request.verificationReceiptSha256());

        // First settlement wins, regardless of what this request says.
        Optional<Settlement> prior = store.getSettlementByEnvelope(envelopeId);
        if (prior.isPresent()) {
            return replay(prior.get());
        }

        Envelope envelope = store.getEnvelope(envelopeId)
            .orElseThrow(() -> CreditException.notFound("envelope not found"));
        if (envelope.status() != EnvelopeStatus.ACCEPTED) {
            throw CreditException.conflict("envelope is not in accepted state");
        }
        if (request.maxFeeMsats() < 0) {
            throw CreditException.invalidRequest("max_fee_msats must be >= 0");
        }

        String invoice = trimToNull(request.providerInvoice());
        String host = trimToNull(request.providerHost());
        if (host != null) {
            host = host.toLowerCase();
        }

        ObjectNode fp = CanonicalJson.object();
        fp.put("schema", CreditSchemas.SETTLE_REQUEST);
        fp.put("envelope_id", envelopeId);
        fp.put("verification_passed", request.verificationPassed());
        fp.put("verification_receipt_sha256", verificationSha);
        fp.put("provider_invoice_hash", invoice == null ? null : CanonicalJson.sha256Hex(invoice));
        fp.put("provider_host", host);
        fp.put("max_fee_msats", request.maxFeeMsats());
        String fingerprint = CanonicalJson.fingerprint(fp);
        String settlementId = CanonicalJson.entityId("ceps", fingerprint);

        if (now.isAfter(envelope.exp())) {
            return settleAsDefault(envelope, settlementId, fingerprint, SettlementOutcome.EXPIRED,
                request.verificationPassed(), verificationSha, now);
        }
        if (!request.verificationPassed()) {
            return settleAsDefault(envelope, settlementId, fingerprint, SettlementOutcome.FAILED,
                false, verificationSha, now);
        }
        return settleWithPayment(envelope, settlementId, fingerprint, invoice, host, verificationSha, request, now);
    }

    private SettleResponse settleAsDefault(Envelope envelope, String settlementId, String fingerprint,
                                           SettlementOutcome outcome, boolean verificationPassed,
                                           String verificationSha, Instant now) {
        Settlement row = new Settlement(
            settlementId, envelope.envelopeId(), envelope.agentId(), envelope.poolId(), envelope.providerId(),
            outcome, 0, 0, verificationPassed, verificationSha, null, now);

        SettlementWrite write = createSettlement(row, fingerprint);
        if (!write.created()) {
            return replay(write.settlement());
        }
        Settlement stored = write.settlement();
        store.updateEnvelopeStatus(envelope.envelopeId(), EnvelopeStatus.DEFAULTED);

        String reason = defaultReason(outcome);
        AttestationEvent label = labeler.build(false, envelope, now).orElse(null);
        CreditReceipt receipt = store.putReceipt(CreditSchemas.ENTITY_SETTLEMENT, settlementId,
            receipts.defaultNotice(stored, envelope, reason, label));
        publish(label);

        metrics.recordSettlement(outcome.wireValue(), 0, 0);
        audit.logDefault(settlementId, envelope.envelopeId(), reason);
        return response(stored, receipt, false);
    }

    private SettleResponse settleWithPayment(Envelope envelope, String settlementId, String fingerprint,
                                             String invoice, String host, String verificationSha,
                                             SettleRequest request, Instant now) {
        if (invoice == null) {
            throw CreditException.invalidRequest("provider_invoice is required");
        }
        if (host == null) {
            throw CreditException.invalidRequest("provider_host is required");
        }
        long amountMsats = invoices.amountMsats(invoice)
            .orElseThrow(() -> CreditException.invalidRequest("provider_invoice must carry an amount"));
        if (amountMsats <= 0) {
            throw CreditException.invalidRequest("provider_invoice amount must be > 0");
        }
        if (amountMsats > Math.multiplyExact(envelope.maxSats(), 1000L)) {
            throw CreditException.invalidRequest("invoice amount exceeds envelope max_sats");
        }

        long spentSats = msatsToSatsCeil(amountMsats);
        HealthReport health = healthMonitor.evaluate(now);
        if (health.breakers().haltLargeSettlements() && spentSats > policy.lnFailureLargeSettlementCapSats()) {
            audit.logBreaker("halt_large_settlements",
                "envelope=" + envelope.envelopeId() + " spent_sats=" + spentSats);
            throw CreditException.dependencyUnavailable("credit circuit breaker: large settlements halted");
        }

        PayResult paid = paymentStep.execute(new SettlementPaymentStep.Plan(
            envelope, fingerprint, invoice, host, amountMsats, request.maxFeeMsats(), request.policyContext(), now));
        if (!paid.succeeded()) {
            // Nothing is written: the envelope stays ACCEPTED and settle may be retried.
            throw CreditException.dependencyUnavailable("payment failed: status=" + paid.status()
                + (paid.errorCode() == null ? "" : " error=" + paid.errorCode()));
        }

        long feeSats = feeSats(spentSats, envelope.feeBps());
        AttestationEvent label = labeler.build(true, envelope, now).orElse(null);

        Settlement row = new Settlement(
            settlementId, envelope.envelopeId(), envelope.agentId(), envelope.poolId(), envelope.providerId(),
            SettlementOutcome.SUCCESS, spentSats, feeSats, true, verificationSha, paid.receiptSha256(), now);

        SettlementWrite write = createSettlement(row, fingerprint);
        if (!write.created()) {
            return replay(write.settlement());
        }
        Settlement stored = write.settlement();
        store.updateEnvelopeStatus(envelope.envelopeId(), EnvelopeStatus.SETTLED);

        CreditReceipt receipt = store.putReceipt(CreditSchemas.ENTITY_SETTLEMENT, settlementId,
            receipts.settlement(stored, envelope, label));
        publish(label);

        metrics.recordSettlement(SettlementOutcome.SUCCESS.wireValue(), spentSats, feeSats);
        audit.logSettlement(settlementId, envelope.envelopeId(), SettlementOutcome.SUCCESS.wireValue(), spentSats, feeSats);
        return response(stored, receipt, false);
    }

    /**
     * A racing settle with different parameters loses to whichever row landed first.
     */
    private SettlementWrite createSettlement(Settlement row, String fingerprint) {
        try {
            return store.createOrGetSettlement(row, fingerprint);
        } catch (CreditStoreException e) {
            if (e.getKind() != CreditStoreException.Kind.CONFLICT) {
                throw e;
            }
            Settlement winner = store.getSettlementByEnvelope(row.envelopeId()).orElseThrow(() -> e);
            return new SettlementWrite(winner, false);
        }
    }

    private SettleResponse replay(Settlement settlement) {
        CreditReceipt receipt = store.getReceipt(
                CreditSchemas.ENTITY_SETTLEMENT, settlement.settlementId(), settlement.outcome().receiptSchema())
            .orElseGet(() -> restoreReceipt(settlement));
        return response(settlement, receipt, true);
    }

    /**
     * The settlement row landed but the process stopped before the envelope flip or the receipt write.
     */
    private CreditReceipt restoreReceipt(Settlement settlement) {
        Envelope envelope = store.getEnvelope(settlement.envelopeId())
            .orElseThrow(() -> CreditException.internal("settlement without envelope: " + settlement.envelopeId(), null));
        log.warn("[CEP] restoring missing receipt for settlement {}", settlement.settlementId());

        EnvelopeStatus terminal = settlement.outcome().isLoss() ? EnvelopeStatus.DEFAULTED : EnvelopeStatus.SETTLED;
        if (envelope.status() != terminal) {
            store.updateEnvelopeStatus(envelope.envelopeId(), terminal);
        }
        CreditReceipt receipt = settlement.outcome().isLoss()
            ? receipts.defaultNotice(settlement, envelope, defaultReason(settlement.outcome()), null)
            : receipts.settlement(settlement, envelope, null);
        return store.putReceipt(CreditSchemas.ENTITY_SETTLEMENT, settlement.settlementId(), receipt);
    }

    private static SettleResponse response(Settlement settlement, CreditReceipt receipt, boolean replayed) {
        return new SettleResponse(CreditSchemas.SETTLE_RESPONSE, settlement, receipt, replayed);
    }

    private void publish(AttestationEvent label) {
        if (label == null) {
            return;
        }
        try {
            attestations.publish(label);
        } catch (RuntimeException e) {
            log.warn("[CEP] attestation publish failed for event {}: {}", label.eventId(), e.getMessage());
        }
    }

    private static String defaultReason(SettlementOutcome outcome) {
        return outcome == SettlementOutcome.EXPIRED ? "expired" : "verification_failed";
    }

    static long msatsToSatsCeil(long amountMsats) {
        return Math.max((amountMsats + 999) / 1000, 1);
    }

    static long feeSats(long spentSats, int feeBps) {
        return (Math.multiplyExact(spentSats, (long) feeBps) + 9_999) / 10_000;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    // ═══════════════════════════════════════════════════════════════
    // Agent exposure
    // ═══════════════════════════════════════════════════════════════

    private AgentExposure doAgentExposure(String rawAgentId) {
        Instant now = clock.instant();
        String agentId = validator.requireId("agent_id", rawAgentId);
        UnderwritingDecision decision = underwriting.evaluate(agentId, now);
        UnderwritingStats stats = decision.stats();
        return new AgentExposure(
            CreditSchemas.AGENT_EXPOSURE_RESPONSE,
            agentId,
            stats.openEnvelopeCount(),
            stats.openExposureSats(),
            stats.settledCount30d(),
            stats.successVolumeSats30d(),
            stats.passRate30d(),
            stats.lossCount30d(),
            stats.weightedLossScore(),
            decision.limitSats(),
            decision.feeBps(),
            decision.requiresVerifier(),
            now);
    }

    // ═══════════════════════════════════════════════════════════════

    private <T> CompletableFuture<T> run(String operation, Supplier<T> body) {
        return CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            try {
                T result = body.get();
                metrics.recordOperation(operation, "ok", Duration.ofNanos(System.nanoTime() - started));
                return result;
            } catch (RuntimeException e) {
                CreditException failure = toCreditException(operation, e);
                metrics.recordOperation(operation, failure.getCode().wireCode(), Duration.ofNanos(System.nanoTime() - started));
                throw failure;
            }
        }, executor);
    }

    private CreditException toCreditException(String operation, RuntimeException e) {
        if (e instanceof CreditException) {
            CreditException ce = (CreditException) e;
            log.debug("[CEP] {} rejected: {}", operation, ce.toString());
            return ce;
        }
        if (e instanceof CreditStoreException) {
            CreditStoreException se = (CreditStoreException) e;
            switch (se.getKind()) {
                case CONFLICT:
                    return new CreditException(CreditErrorCode.CONFLICT, se.getMessage(), se);
                case NOT_FOUND:
                    return new CreditException(CreditErrorCode.NOT_FOUND, se.getMessage(), se);
                default:
                    audit.logError(operation, se.getMessage());
                    return CreditException.internal("store failure: " + se.getMessage(), se);
            }
        }
        log.error("[CEP] {} failed unexpectedly: {}", operation, e.getMessage(), e);
        audit.logError(operation, String.valueOf(e.getMessage()));
        return CreditException.internal(operation + " failed: " + e.getMessage(), e);
    }
}
