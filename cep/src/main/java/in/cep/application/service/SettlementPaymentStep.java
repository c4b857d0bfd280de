package in.cep.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.cep.application.port.output.CreditStore;
import in.cep.application.port.output.LiquidityException;
import in.cep.application.port.output.LiquidityPayments;
import in.cep.domain.common.CreditException;
import in.cep.domain.credit.CreditSchemas;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.LiquidityPayEvent;
import in.cep.domain.liquidity.PayQuote;
import in.cep.domain.liquidity.PayResult;
import in.cep.domain.liquidity.QuotePayRequest;
import in.cep.infrastructure.metrics.CreditMetrics;
import in.cep.security.CanonicalJson;
import in.cep.security.CreditAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Payment leg of a successful settlement: quote, pay, record the attempt.
 *
 * This step runs before the settlement row is written and there is no two-phase commit between
 * the two. If the process dies (or the ledger write fails) after a successful pay, the envelope stays
 * ACCEPTED and a retried settle pays again. The quote carries an idempotency key derived from the
 * settle fingerprint ({@code cep:quote:<24 hex>}) so the liquidity service can collapse such retries
 * at invoice level.
 */
public final class SettlementPaymentStep {
    private static final Logger log = LoggerFactory.getLogger(SettlementPaymentStep.class);

    private final LiquidityPayments payments;
    private final CreditStore store;
    private final CreditMetrics metrics;
    private final CreditAuditLogger audit;

    public SettlementPaymentStep(LiquidityPayments payments, CreditStore store,
                                 CreditMetrics metrics, CreditAuditLogger audit) {
        this.payments = payments;
        this.store = store;
        this.metrics = metrics;
        this.audit = audit;
    }

    /**
     * What to pay for one envelope.
     *
     * @param settleFingerprint fingerprint of the settle request, seeds the payment idempotency key
     * @param callerContext     caller supplied policy context, forwarded verbatim
     */
    public record Plan(
        Envelope envelope,
        String settleFingerprint,
        String invoice,
        String host,
        long amountMsats,
        long maxFeeMsats,
        JsonNode callerContext,
        Instant now
    ) {}

    public static String paymentIdempotencyKey(String settleFingerprint) {
        return "cep:quote:" + settleFingerprint.substring(0, 24);
    }

    /**
     * Quote and pay the invoice, then record the attempt for health monitoring.
     *
     * @return the pay result, whatever its status
     * @throws CreditException DEPENDENCY_UNAVAILABLE if the liquidity service cannot be reached
     */
    public PayResult execute(Plan plan) {
        Envelope envelope = plan.envelope();
        QuotePayRequest quoteRequest = new QuotePayRequest(
            paymentIdempotencyKey(plan.settleFingerprint()),
            plan.invoice(),
            plan.host(),
            plan.amountMsats(),
            plan.maxFeeMsats(),
            policyContext(envelope, plan.callerContext()));

        PayQuote quote = await("quote", () -> payments.quotePay(quoteRequest));
        PayResult result = await("pay", () -> payments.pay(quote.quoteId()));

        metrics.recordPayment(result.status());
        audit.logPayment(envelope.envelopeId(), quote.quoteId(), result.status(), plan.host());
        recordAttempt(new LiquidityPayEvent(
            quote.quoteId(),
            envelope.envelopeId(),
            result.status(),
            result.errorCode(),
            plan.amountMsats(),
            plan.host(),
            plan.now()));
        return result;
    }

    // The payment already happened; losing one health sample must not fail the settlement.
    private void recordAttempt(LiquidityPayEvent event) {
        try {
            store.putLiquidityPayEvent(event);
        } catch (RuntimeException e) {
            log.warn("[CEP] failed to record pay event quote={} envelope={}: {}",
                event.quoteId(), event.envelopeId(), e.getMessage());
        }
    }

    private JsonNode policyContext(Envelope envelope, JsonNode callerContext) {
        ObjectNode context = CanonicalJson.object();
        context.put("schema", CreditSchemas.POLICY_CONTEXT);
        context.put("envelope_id", envelope.envelopeId());
        context.put("agent_id", envelope.agentId());
        context.put("pool_id", envelope.poolId());
        context.put("provider_id", envelope.providerId());
        context.put("scope_type", envelope.scopeType().wireValue());
        context.put("scope_id", envelope.scopeId());
        if (callerContext != null && !callerContext.isNull()) {
            context.set("caller_context", callerContext);
        }
        return context;
    }

    private <T> T await(String call, Supplier<CompletableFuture<T>> invocation) {
        try {
            return invocation.get().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CreditException.dependencyUnavailable("liquidity " + call + " interrupted");
        } catch (ExecutionException e) {
            throw mapFailure(call, e.getCause());
        } catch (LiquidityException e) {
            throw mapFailure(call, e);
        }
    }

    private static CreditException mapFailure(String call, Throwable failure) {
        if (!(failure instanceof LiquidityException)) {
            log.error("[CEP] liquidity {} failed: {}", call, failure == null ? "unknown" : failure.getMessage());
            return CreditException.dependencyUnavailable("liquidity " + call + " failed");
        }
        LiquidityException e = (LiquidityException) failure;
        return switch (e.getKind()) {
            case INVALID_REQUEST -> CreditException.invalidRequest(e.getMessage());
            case NOT_FOUND -> CreditException.dependencyUnavailable("quote not found");
            case CONFLICT -> CreditException.conflict(e.getMessage());
            case DEPENDENCY_UNAVAILABLE -> CreditException.dependencyUnavailable(e.getMessage());
            case INTERNAL -> CreditException.internal("liquidity " + call + " failed: " + e.getMessage(), e);
        };
    }
}
