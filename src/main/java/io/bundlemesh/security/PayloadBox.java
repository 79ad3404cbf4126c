package io.bundlemesh.security;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Authenticated public-key encryption between two identity keys.
 *
 * <p>X25519 agreement, HKDF-SHA256 bound to both public keys, then the NaCl
 * secretbox construction (XSalsa20 keystream, Poly1305 tag). Output layout:
 * {@code nonce[24] | tag[16] | ciphertext}.
 */
public final class PayloadBox {
    public static final int PUBLIC_KEY_BYTES = X25519PublicKeyParameters.KEY_SIZE;
    public static final int NONCE_BYTES = 24;
    public static final int TAG_BYTES = 16;
    private static final int KEY_BYTES = 32;
    private static final byte[] INFO_PREFIX = "bundlemesh.box.v1".getBytes(StandardCharsets.US_ASCII);
    private static final SecureRandom RANDOM = new SecureRandom();

    private PayloadBox() {
    }

    public static byte[] encryptFor(byte[] plaintext, byte[] recipientPublicKey, KeyHandle senderPrivateKey) {
        requirePublicKey(recipientPublicKey);
        X25519PrivateKeyParameters sender = new X25519PrivateKeyParameters(senderPrivateKey.material(), 0);
        byte[] senderPublic = sender.generatePublicKey().getEncoded();
        byte[] key = deriveKey(sender, recipientPublicKey, senderPublic, recipientPublicKey);
        try {
            byte[] nonce = new byte[NONCE_BYTES];
            RANDOM.nextBytes(nonce);
            XSalsa20Engine stream = keystream(key, nonce);
            byte[] macKey = new byte[KEY_BYTES];
            stream.processBytes(new byte[KEY_BYTES], 0, KEY_BYTES, macKey, 0);
            byte[] out = new byte[NONCE_BYTES + TAG_BYTES + plaintext.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_BYTES);
            stream.processBytes(plaintext, 0, plaintext.length, out, NONCE_BYTES + TAG_BYTES);
            byte[] tag = tag(macKey, out, NONCE_BYTES + TAG_BYTES, plaintext.length);
            System.arraycopy(tag, 0, out, NONCE_BYTES, TAG_BYTES);
            Arrays.fill(macKey, (byte) 0);
            return out;
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public static byte[] decryptFrom(byte[] ciphertext, byte[] senderPublicKey, KeyHandle recipientPrivateKey) {
        if (ciphertext == null || ciphertext.length < NONCE_BYTES + TAG_BYTES) {
            throw new AuthenticationException("Ciphertext too short");
        }
        if (senderPublicKey == null || senderPublicKey.length != PUBLIC_KEY_BYTES) {
            throw new AuthenticationException("Sender key must be " + PUBLIC_KEY_BYTES + " bytes");
        }
        X25519PrivateKeyParameters recipient = new X25519PrivateKeyParameters(recipientPrivateKey.material(), 0);
        byte[] recipientPublic = recipient.generatePublicKey().getEncoded();
        byte[] key = deriveKey(recipient, senderPublicKey, senderPublicKey, recipientPublic);
        try {
            byte[] nonce = Arrays.copyOfRange(ciphertext, 0, NONCE_BYTES);
            XSalsa20Engine stream = keystream(key, nonce);
            byte[] macKey = new byte[KEY_BYTES];
            stream.processBytes(new byte[KEY_BYTES], 0, KEY_BYTES, macKey, 0);
            int bodyOffset = NONCE_BYTES + TAG_BYTES;
            int bodyLength = ciphertext.length - bodyOffset;
            byte[] expected = tag(macKey, ciphertext, bodyOffset, bodyLength);
            Arrays.fill(macKey, (byte) 0);
            byte[] actual = Arrays.copyOfRange(ciphertext, NONCE_BYTES, bodyOffset);
            if (!org.bouncycastle.util.Arrays.constantTimeAreEqual(expected, actual)) {
                throw new AuthenticationException("Payload authentication failed");
            }
            byte[] plaintext = new byte[bodyLength];
            stream.processBytes(ciphertext, bodyOffset, bodyLength, plaintext, 0);
            return plaintext;
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public static byte[] publicKeyOf(KeyHandle boxKey) {
        return new X25519PrivateKeyParameters(boxKey.material(), 0).generatePublicKey().getEncoded();
    }

    private static byte[] deriveKey(
            X25519PrivateKeyParameters ownPrivate,
            byte[] peerPublic,
            byte[] senderPublic,
            byte[] recipientPublic
    ) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(ownPrivate);
        byte[] shared = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(new X25519PublicKeyParameters(peerPublic, 0), shared, 0);
        } catch (IllegalStateException e) {
            throw new AuthenticationException("Key agreement rejected peer key", e);
        }
        byte[] info = new byte[INFO_PREFIX.length + senderPublic.length + recipientPublic.length];
        System.arraycopy(INFO_PREFIX, 0, info, 0, INFO_PREFIX.length);
        System.arraycopy(senderPublic, 0, info, INFO_PREFIX.length, senderPublic.length);
        System.arraycopy(recipientPublic, 0, info, INFO_PREFIX.length + senderPublic.length, recipientPublic.length);
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(shared, null, info));
        byte[] key = new byte[KEY_BYTES];
        hkdf.generateBytes(key, 0, KEY_BYTES);
        Arrays.fill(shared, (byte) 0);
        return key;
    }

    private static XSalsa20Engine keystream(byte[] key, byte[] nonce) {
        XSalsa20Engine engine = new XSalsa20Engine();
        engine.init(true, new ParametersWithIV(new KeyParameter(key), nonce));
        return engine;
    }

    private static byte[] tag(byte[] macKey, byte[] data, int offset, int length) {
        Poly1305 mac = new Poly1305();
        mac.init(new KeyParameter(macKey));
        mac.update(data, offset, length);
        byte[] out = new byte[TAG_BYTES];
        mac.doFinal(out, 0);
        return out;
    }

    private static void requirePublicKey(byte[] key) {
        if (key == null || key.length != PUBLIC_KEY_BYTES) {
            throw new IllegalArgumentException("Recipient key must be " + PUBLIC_KEY_BYTES + " bytes");
        }
    }
}
