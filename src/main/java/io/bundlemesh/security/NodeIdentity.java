package io.bundlemesh.security;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;

/**
 * Long-lived keys of one node.
 *
 * <p>The signing key (Ed25519) signs every bundle the node creates. The box key
 * (X25519) receives unicast payloads and its public half is the node address.
 * The community key is a shared X25519 key held by every member; multicast and
 * trusted-broadcast payloads are sealed to its public half.
 */
public final class NodeIdentity {
    private static final Logger log = LoggerFactory.getLogger(NodeIdentity.class);
    public static final String SIGNING_KEY_FILE = "identity-sign.key";
    public static final String BOX_KEY_FILE = "identity-box.key";
    public static final String COMMUNITY_KEY_FILE = "community-box.key";
    private static final int KEY_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyHandle signingKey;
    private final KeyHandle boxKey;
    private final KeyHandle communityKey;
    private final byte[] signingPublicKey;
    private final byte[] boxPublicKey;
    private final byte[] communityPublicKey;

    private NodeIdentity(KeyHandle signingKey, KeyHandle boxKey, KeyHandle communityKey) {
        this.signingKey = signingKey;
        this.boxKey = boxKey;
        this.communityKey = communityKey;
        this.signingPublicKey = Signatures.publicKeyOf(signingKey);
        this.boxPublicKey = PayloadBox.publicKeyOf(boxKey);
        this.communityPublicKey = PayloadBox.publicKeyOf(communityKey);
    }

    public static NodeIdentity loadOrCreate(Path securityDir) {
        try {
            Files.createDirectories(securityDir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create security directory: " + securityDir, e);
        }
        KeyHandle signing = loadOrCreateKey(securityDir.resolve(SIGNING_KEY_FILE), "identity-sign", true);
        KeyHandle box = loadOrCreateKey(securityDir.resolve(BOX_KEY_FILE), "identity-box", false);
        KeyHandle community = loadOrCreateKey(securityDir.resolve(COMMUNITY_KEY_FILE), "community-box", false);
        return new NodeIdentity(signing, box, community);
    }

    /**
     * In-memory identity sharing the given community secret.
     */
    public static NodeIdentity ephemeral(byte[] communitySecret) {
        return new NodeIdentity(
                new KeyHandle("identity-sign", newEd25519(), null),
                new KeyHandle("identity-box", newX25519(), null),
                KeyHandle.ephemeral("community-box", communitySecret)
        );
    }

    public static byte[] newCommunitySecret() {
        return newX25519();
    }

    /**
     * Installs a community secret before the node is first loaded. An existing
     * community key is left untouched.
     */
    public static boolean installCommunityKey(Path securityDir, byte[] secret) {
        if (secret == null || secret.length != KEY_BYTES) {
            throw new IllegalArgumentException("Community key must be " + KEY_BYTES + " bytes");
        }
        Path file = securityDir.resolve(COMMUNITY_KEY_FILE);
        if (Files.exists(file)) {
            return false;
        }
        writeKeyFile(file, secret);
        return true;
    }

    public static byte[] exportCommunityKey(Path securityDir) {
        Path file = securityDir.resolve(COMMUNITY_KEY_FILE);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read community key: " + file, e);
        }
    }

    public byte[] signingPublicKey() {
        return signingPublicKey.clone();
    }

    public byte[] boxPublicKey() {
        return boxPublicKey.clone();
    }

    public byte[] communityPublicKey() {
        return communityPublicKey.clone();
    }

    /**
     * Hex X25519 public key, used as the unicast scope of destinations.
     */
    public String address() {
        return Hex.toHexString(boxPublicKey);
    }

    public byte[] sign(byte[] data) {
        return Signatures.sign(data, signingKey);
    }

    public byte[] sealFor(byte[] plaintext, byte[] recipientBoxKey) {
        return PayloadBox.encryptFor(plaintext, recipientBoxKey, boxKey);
    }

    public byte[] openFrom(byte[] ciphertext, byte[] senderBoxKey) {
        return PayloadBox.decryptFrom(ciphertext, senderBoxKey, boxKey);
    }

    public byte[] openCommunity(byte[] ciphertext, byte[] senderBoxKey) {
        return PayloadBox.decryptFrom(ciphertext, senderBoxKey, communityKey);
    }

    public boolean isWiped() {
        return signingKey.isErased() && boxKey.isErased();
    }

    /**
     * Destroys the node's own keys in memory and on disk. The shared community
     * key is erased from memory only; other members still rely on it.
     */
    public void wipe() {
        KeyEraser.secureErase(signingKey);
        KeyEraser.secureErase(boxKey);
        KeyEraser.eraseInMemory(communityKey);
    }

    private static KeyHandle loadOrCreateKey(Path file, String label, boolean signing) {
        byte[] material;
        if (Files.exists(file)) {
            try {
                material = Files.readAllBytes(file);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read key file: " + file, e);
            }
            if (material.length != KEY_BYTES) {
                throw new RuntimeException("Corrupt key file (expected " + KEY_BYTES + " bytes): " + file);
            }
        } else {
            material = signing ? newEd25519() : newX25519();
            writeKeyFile(file, material);
            log.info("Generated {} key at {}", label, file);
        }
        return new KeyHandle(label, material, file);
    }

    private static void writeKeyFile(Path file, byte[] material) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.write(file, material, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                log.debug("POSIX permissions not supported for {}", file);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write key file: " + file, e);
        }
    }

    private static byte[] newEd25519() {
        return new Ed25519PrivateKeyParameters(RANDOM).getEncoded();
    }

    private static byte[] newX25519() {
        return new X25519PrivateKeyParameters(RANDOM).getEncoded();
    }
}
