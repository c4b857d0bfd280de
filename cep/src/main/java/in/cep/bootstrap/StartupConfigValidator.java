package in.cep.bootstrap;

import in.cep.config.CreditPolicyConfig;
import in.cep.security.ReceiptSigner;
import in.cep.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before the engine is wired. Throws IllegalStateException if the configuration
 * is not fit for the selected mode; the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static final String PRODUCTION_MODE = "CEP_PRODUCTION_MODE";

    /**
     * Validate configuration at startup.
     *
     * @param policy loaded (and range checked) credit policy
     * @param signer receipt signer built from the configured key material
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(CreditPolicyConfig policy, ReceiptSigner signer) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        boolean productionMode = Env.getBool(PRODUCTION_MODE, false);
        log.info("Production mode: {}", productionMode);

        if (productionMode) {
            validateProductionMode(policy, signer);
        } else {
            warnNonProductionMode(policy, signer);
        }

        log.info("Policy: max_sats_per_envelope={}, max_outstanding={}, max_offer_ttl={}s, fee_bps=[{}, {}]",
            policy.maxSatsPerEnvelope(), policy.maxOutstandingEnvelopesPerAgent(), policy.maxOfferTtlSeconds(),
            policy.minFeeBps(), policy.maxFeeBps());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(CreditPolicyConfig policy, ReceiptSigner signer) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (!signer.isEnabled()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires a receipt signing key\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Set CEP_RECEIPT_SIGNING_PRIVATE_KEY and CEP_RECEIPT_SIGNING_PUBLIC_KEY\n" +
                "  2. Set " + PRODUCTION_MODE + "=false for local testing"
            );
        }
        log.info("✓ Receipt signing enabled (public key {}...)", signer.publicKeyB64().substring(0, 16));

        if (!policy.exclusiveOfferAcceptance()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires CEP_EXCLUSIVE_OFFER_ACCEPTANCE=true\n" +
                "Non-exclusive acceptance lets one offer back several envelopes.\n" +
                "Either:\n" +
                "  1. Set CEP_EXCLUSIVE_OFFER_ACCEPTANCE=true\n" +
                "  2. Set " + PRODUCTION_MODE + "=false"
            );
        }
        log.info("✓ Exclusive offer acceptance enabled");

        log.info("✅ PRODUCTION MODE validation passed");
    }

    private static void warnNonProductionMode(CreditPolicyConfig policy, ReceiptSigner signer) {
        log.warn("⚠️  ════════════════════════════════════════════════════════");
        log.warn("⚠️  NON-PRODUCTION MODE detected");
        log.warn("⚠️  ════════════════════════════════════════════════════════");

        if (!signer.isEnabled()) {
            log.warn("⚠️  No receipt signing key - receipts will be unsigned and no labels published");
        }
        if (!policy.exclusiveOfferAcceptance()) {
            log.warn("⚠️  Exclusive offer acceptance DISABLED - one offer may back several envelopes");
        }
    }

    private StartupConfigValidator() {}
}
