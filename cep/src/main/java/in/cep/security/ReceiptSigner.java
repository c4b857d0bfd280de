package in.cep.security;

import in.cep.domain.credit.ReceiptSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;

/**
 * Signs receipt digests with a process-wide Ed25519 key.
 *
 * A signer without a key is valid: receipts stay hash-addressed but carry no signature.
 * The signed message is the UTF-8 bytes of the lowercase hex digest.
 */
public final class ReceiptSigner {
    private static final Logger log = LoggerFactory.getLogger(ReceiptSigner.class);

    public static final String SCHEME = "ed25519";
    private static final String ALGORITHM = "Ed25519";
    private static final String KEY_CHECK_MESSAGE = "openagents.credit.key_check";

    private final PrivateKey privateKey;
    private final PublicKey publicKey;
    private final String publicKeyB64;

    private ReceiptSigner(PrivateKey privateKey, PublicKey publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.publicKeyB64 = publicKey == null ? null : Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public static ReceiptSigner unsigned() {
        return new ReceiptSigner(null, null);
    }

    public static ReceiptSigner of(KeyPair keyPair) {
        return new ReceiptSigner(keyPair.getPrivate(), keyPair.getPublic());
    }

    /**
     * Load key material from base64 PKCS#8 (private) and X.509 (public) encodings.
     * Both null or blank yields an unsigned signer.
     *
     * @throws IllegalStateException if only one half is present or the material does not decode
     */
    public static ReceiptSigner fromBase64(String privateKeyB64, String publicKeyB64) {
        boolean hasPrivate = privateKeyB64 != null && !privateKeyB64.isBlank();
        boolean hasPublic = publicKeyB64 != null && !publicKeyB64.isBlank();
        if (!hasPrivate && !hasPublic) {
            return unsigned();
        }
        if (hasPrivate != hasPublic) {
            throw new IllegalStateException("receipt signing key requires both private and public key material");
        }
        try {
            KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
            PrivateKey priv = kf.generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(privateKeyB64.trim())));
            PublicKey pub = kf.generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(publicKeyB64.trim())));
            requireMatchingPair(priv, pub);
            return new ReceiptSigner(priv, pub);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("invalid receipt signing key material: " + e.getMessage(), e);
        }
    }

    // Receipts signed with a mismatched pair would never verify.
    private static void requireMatchingPair(PrivateKey priv, PublicKey pub) throws GeneralSecurityException {
        byte[] message = KEY_CHECK_MESSAGE.getBytes(StandardCharsets.UTF_8);
        Signature signer = Signature.getInstance(ALGORITHM);
        signer.initSign(priv);
        signer.update(message);
        byte[] signature = signer.sign();

        Signature verifier = Signature.getInstance(ALGORITHM);
        verifier.initVerify(pub);
        verifier.update(message);
        if (!verifier.verify(signature)) {
            throw new IllegalStateException("receipt signing public key does not match the private key");
        }
    }

    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    public boolean isEnabled() {
        return privateKey != null;
    }

    public String publicKeyB64() {
        return publicKeyB64;
    }

    /**
     * @return the signature, or empty when no key is configured
     */
    public Optional<ReceiptSignature> sign(String sha256Hex) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new ReceiptSignature(SCHEME, publicKeyB64, sha256Hex, signB64(sha256Hex)));
    }

    /**
     * Sign arbitrary text, returning base64 signature bytes.
     */
    public String signB64(String message) {
        if (!isEnabled()) {
            throw new IllegalStateException("receipt signer has no key");
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(privateKey);
            sig.update(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(sig.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("receipt signing failed", e);
        }
    }

    /**
     * Verify a signature using only the public key it carries.
     */
    public static boolean verify(ReceiptSignature signature) {
        if (signature == null || !SCHEME.equals(signature.scheme())) {
            return false;
        }
        try {
            KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
            PublicKey pub = kf.generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(signature.signerPublicKey())));
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(signature.signedSha256().getBytes(StandardCharsets.UTF_8));
            return sig.verify(Base64.getDecoder().decode(signature.signature()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Receipt signature rejected: {}", e.getMessage());
            return false;
        }
    }
}
