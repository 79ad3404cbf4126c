package io.bundlemesh.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Destroys key material: zero, random, zero over the in-memory bytes and over
 * any persisted copy, then deletes the file and flushes the directory entry.
 */
public final class KeyEraser {
    private static final Logger log = LoggerFactory.getLogger(KeyEraser.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int PASSES = 3;

    private KeyEraser() {
    }

    public static void secureErase(KeyHandle handle) {
        synchronized (handle) {
            if (handle.isErased()) {
                return;
            }
            overwrite(handle);
            Path persisted = handle.persistedAt().orElse(null);
            if (persisted != null) {
                erasePersistedCopy(persisted);
            }
            log.info("Erased key material: {}", handle.label());
        }
    }

    /**
     * Clears the in-memory copy only; a persisted file is kept.
     */
    static void eraseInMemory(KeyHandle handle) {
        synchronized (handle) {
            if (!handle.isErased()) {
                overwrite(handle);
            }
        }
    }

    private static void overwrite(KeyHandle handle) {
        byte[] backing = handle.backingArray();
        for (int pass = 0; pass < PASSES; pass++) {
            fillPass(backing, pass);
        }
        handle.markErased();
    }

    private static void erasePersistedCopy(Path file) {
        try {
            if (Files.exists(file)) {
                long size = Files.size(file);
                try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
                    byte[] block = new byte[(int) Math.min(size, 8192L)];
                    for (int pass = 0; pass < PASSES; pass++) {
                        channel.position(0L);
                        long written = 0L;
                        while (written < size) {
                            int chunk = (int) Math.min(block.length, size - written);
                            fillPass(block, pass);
                            ByteBuffer buffer = ByteBuffer.wrap(block, 0, chunk);
                            while (buffer.hasRemaining()) {
                                written += channel.write(buffer);
                            }
                        }
                        channel.force(true);
                    }
                }
                Files.delete(file);
            }
        } catch (IOException e) {
            throw new KeyErasureException("Failed to erase persisted key: " + file, e);
        }
        syncDirectory(file.toAbsolutePath().getParent());
    }

    private static void syncDirectory(Path dir) {
        if (dir == null) {
            return;
        }
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // Some platforms cannot open a directory as a channel; the delete itself already succeeded.
            log.warn("Directory sync after key deletion not supported for {}: {}", dir, e.getMessage());
        }
    }

    private static void fillPass(byte[] target, int pass) {
        if (pass == 1) {
            RANDOM.nextBytes(target);
        } else {
            Arrays.fill(target, (byte) 0);
        }
    }
}
