package in.cep.bootstrap;

import in.cep.config.CreditPolicyConfig;
import in.cep.security.ReceiptSigner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Startup Config Validator Tests")
class StartupConfigValidatorTest {

    @AfterEach
    void clear() {
        System.clearProperty(StartupConfigValidator.PRODUCTION_MODE);
    }

    @Test
    @DisplayName("Non-production mode accepts an unsigned engine")
    void validate_nonProductionAllowsUnsigned() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(CreditPolicyConfig.defaults(), ReceiptSigner.unsigned()));
    }

    @Test
    @DisplayName("Production mode requires a signing key")
    void validate_productionRequiresSigningKey() {
        System.setProperty(StartupConfigValidator.PRODUCTION_MODE, "true");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(CreditPolicyConfig.defaults(), ReceiptSigner.unsigned()));
        assertTrue(e.getMessage().contains("receipt signing key"));
    }

    @Test
    @DisplayName("Production mode requires exclusive offer acceptance")
    void validate_productionRequiresExclusiveAcceptance() {
        System.setProperty(StartupConfigValidator.PRODUCTION_MODE, "true");
        CreditPolicyConfig legacy = CreditPolicyConfig.builder().exclusiveOfferAcceptance(false).build();
        ReceiptSigner signer = ReceiptSigner.of(ReceiptSigner.generateKeyPair());

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(legacy, signer));
        assertTrue(e.getMessage().contains("CEP_EXCLUSIVE_OFFER_ACCEPTANCE"));

        assertDoesNotThrow(() -> StartupConfigValidator.validate(CreditPolicyConfig.defaults(), signer));
    }
}
