package in.cep.domain.credit;

/**
 * Detached signature over a receipt digest.
 *
 * @param scheme          signature scheme, currently always "ed25519"
 * @param signerPublicKey base64 X.509 encoded public key
 * @param signedSha256    hex digest that was signed
 * @param signature       base64 signature bytes
 */
public record ReceiptSignature(
    String scheme,
    String signerPublicKey,
    String signedSha256,
    String signature
) {}
