package io.bundlemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bundlemesh.util.Jsons;
import org.bouncycastle.crypto.generators.SCrypt;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Passphrase-sealed storage for local secrets such as recovery phrases.
 * Unrelated to bundle payload encryption.
 */
public final class SecretVault {
    public static final String SCHEMA = "bundlemesh.scrypt-aesgcm.v1";
    public static final int DEFAULT_COST = 1 << 15;
    public static final int DEFAULT_BLOCK_SIZE = 8;
    public static final int DEFAULT_PARALLELISM = 1;
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int SALT_BYTES = 16;
    private static final int KEY_BYTES = 32;
    private static final int MAX_COST = 1 << 20;

    private final int cost;
    private final int blockSize;
    private final int parallelism;
    private final SecureRandom secureRandom;

    public SecretVault() {
        this(DEFAULT_COST, DEFAULT_BLOCK_SIZE, DEFAULT_PARALLELISM);
    }

    public SecretVault(int cost, int blockSize, int parallelism) {
        if (cost < 2 || Integer.bitCount(cost) != 1) {
            throw new IllegalArgumentException("scrypt cost must be a power of two > 1: " + cost);
        }
        if (blockSize < 1 || parallelism < 1) {
            throw new IllegalArgumentException("scrypt block size and parallelism must be positive");
        }
        this.cost = cost;
        this.blockSize = blockSize;
        this.parallelism = parallelism;
        this.secureRandom = new SecureRandom();
    }

    public String seal(char[] passphrase, byte[] secret) {
        byte[] salt = new byte[SALT_BYTES];
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(salt);
        secureRandom.nextBytes(iv);
        byte[] key = deriveKey(passphrase, salt, cost, blockSize, parallelism);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(SCHEMA.getBytes(StandardCharsets.US_ASCII));
            byte[] cipherText = cipher.doFinal(secret);
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kdf", "scrypt");
            row.put("n", cost);
            row.put("r", blockSize);
            row.put("p", parallelism);
            row.put("salt", Base64.getEncoder().encodeToString(salt));
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to seal secret", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public byte[] open(char[] passphrase, String sealed) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(sealed);
        } catch (IOException e) {
            throw new IllegalArgumentException("Sealed secret is not JSON", e);
        }
        if (node == null || !SCHEMA.equals(node.path("enc").asText(""))) {
            throw new IllegalArgumentException("Unsupported sealed secret format");
        }
        String saltBase64 = node.path("salt").asText("");
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (saltBase64.isBlank() || ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new IllegalArgumentException("Invalid sealed secret format: missing salt/iv/ct");
        }
        int n = node.path("n").asInt(DEFAULT_COST);
        int r = node.path("r").asInt(DEFAULT_BLOCK_SIZE);
        int p = node.path("p").asInt(DEFAULT_PARALLELISM);
        if (n < 2 || n > MAX_COST || Integer.bitCount(n) != 1 || r < 1 || r > 64 || p < 1 || p > 16) {
            throw new IllegalArgumentException("Sealed secret has out-of-range scrypt parameters");
        }
        byte[] salt = Base64.getDecoder().decode(saltBase64);
        byte[] iv = Base64.getDecoder().decode(ivBase64);
        byte[] cipherText = Base64.getDecoder().decode(ctBase64);
        byte[] key = deriveKey(passphrase, salt, n, r, p);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(SCHEMA.getBytes(StandardCharsets.US_ASCII));
            return cipher.doFinal(cipherText);
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("Wrong passphrase or tampered secret", e);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to open sealed secret", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public void sealToFile(Path file, char[] passphrase, byte[] secret) {
        String sealed = seal(passphrase, secret);
        try {
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            Files.writeString(file, sealed, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write sealed secret: " + file, e);
        }
    }

    public byte[] openFile(Path file, char[] passphrase) {
        try {
            return open(passphrase, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read sealed secret: " + file, e);
        }
    }

    private static byte[] deriveKey(char[] passphrase, byte[] salt, int n, int r, int p) {
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(passphrase));
        byte[] raw = new byte[encoded.remaining()];
        encoded.get(raw);
        if (encoded.hasArray()) {
            Arrays.fill(encoded.array(), (byte) 0);
        }
        try {
            return SCrypt.generate(raw, salt, n, r, p, KEY_BYTES);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }
}
