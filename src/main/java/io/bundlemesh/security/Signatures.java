package io.bundlemesh.security;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ed25519 signing and verification over canonical bundle bytes.
 */
public final class Signatures {
    private static final Logger log = LoggerFactory.getLogger(Signatures.class);
    public static final int PUBLIC_KEY_BYTES = Ed25519PublicKeyParameters.KEY_SIZE;
    public static final int SIGNATURE_BYTES = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

    private Signatures() {
    }

    public static byte[] sign(byte[] data, KeyHandle signingKey) {
        Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(signingKey.material(), 0);
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(data, 0, data.length);
        return signer.generateSignature();
    }

    /**
     * Never throws for bad input; a malformed key or signature simply fails.
     */
    public static boolean verify(byte[] data, byte[] signature, byte[] publicKey) {
        if (data == null || signature == null || publicKey == null) {
            return false;
        }
        if (signature.length != SIGNATURE_BYTES || publicKey.length != PUBLIC_KEY_BYTES) {
            log.debug("Signature check failed on sizes: signature={} key={}", signature.length, publicKey.length);
            return false;
        }
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(data, 0, data.length);
            return verifier.verifySignature(signature);
        } catch (RuntimeException e) {
            log.debug("Signature check failed on malformed key: {}", e.getMessage());
            return false;
        }
    }

    public static byte[] publicKeyOf(KeyHandle signingKey) {
        return new Ed25519PrivateKeyParameters(signingKey.material(), 0).generatePublicKey().getEncoded();
    }
}
