package in.cep.security;

import in.cep.domain.credit.ReceiptSignature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Receipt Signer Tests")
public class ReceiptSignerTest {

    private static final String DIGEST = CanonicalJson.sha256Hex("receipt");

    @Test
    @DisplayName("Unsigned signer produces no signature")
    public void testUnsignedSigner() {
        ReceiptSigner signer = ReceiptSigner.unsigned();

        assertFalse(signer.isEnabled());
        assertTrue(signer.sign(DIGEST).isEmpty());
        assertThrows(IllegalStateException.class, () -> signer.signB64("x"));
    }

    @Test
    @DisplayName("Signature verifies with the embedded public key")
    public void testSignAndVerify() {
        ReceiptSigner signer = ReceiptSigner.of(ReceiptSigner.generateKeyPair());

        ReceiptSignature signature = signer.sign(DIGEST).orElseThrow();

        assertEquals(ReceiptSigner.SCHEME, signature.scheme());
        assertEquals(DIGEST, signature.signedSha256());
        assertEquals(signer.publicKeyB64(), signature.signerPublicKey());
        assertTrue(ReceiptSigner.verify(signature));
    }

    @Test
    @DisplayName("Tampered digest fails verification")
    public void testTamperedDigestRejected() {
        ReceiptSigner signer = ReceiptSigner.of(ReceiptSigner.generateKeyPair());
        ReceiptSignature signature = signer.sign(DIGEST).orElseThrow();

        ReceiptSignature tampered = new ReceiptSignature(signature.scheme(), signature.signerPublicKey(),
            CanonicalJson.sha256Hex("other"), signature.signature());

        assertFalse(ReceiptSigner.verify(tampered));
        assertFalse(ReceiptSigner.verify(null));
    }

    @Test
    @DisplayName("Key material round-trips through base64")
    public void testFromBase64() {
        KeyPair pair = ReceiptSigner.generateKeyPair();
        String priv = Base64.getEncoder().encodeToString(pair.getPrivate().getEncoded());
        String pub = Base64.getEncoder().encodeToString(pair.getPublic().getEncoded());

        ReceiptSigner signer = ReceiptSigner.fromBase64(priv, pub);

        assertTrue(signer.isEnabled());
        assertTrue(ReceiptSigner.verify(signer.sign(DIGEST).orElseThrow()));
    }

    @Test
    @DisplayName("Half-configured or malformed key material is rejected")
    public void testInvalidKeyMaterial() {
        assertFalse(ReceiptSigner.fromBase64(null, " ").isEnabled());
        assertThrows(IllegalStateException.class, () -> ReceiptSigner.fromBase64("abc", null));
        assertThrows(IllegalStateException.class, () -> ReceiptSigner.fromBase64("not-base64!", "also-not!"));
    }

    @Test
    @DisplayName("Private and public key from different pairs are rejected")
    public void testMismatchedKeyPair() {
        KeyPair first = ReceiptSigner.generateKeyPair();
        KeyPair second = ReceiptSigner.generateKeyPair();
        String priv = Base64.getEncoder().encodeToString(first.getPrivate().getEncoded());
        String pub = Base64.getEncoder().encodeToString(second.getPublic().getEncoded());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ReceiptSigner.fromBase64(priv, pub));
        assertTrue(e.getMessage().contains("does not match"));
    }
}
