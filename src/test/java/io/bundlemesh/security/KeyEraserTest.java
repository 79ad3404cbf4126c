package io.bundlemesh.security;

import io.bundlemesh.TestBundles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class KeyEraserTest {

    @Test
    void secureEraseZeroesMemoryAndDeletesPersistedCopy() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-erase-");
        try {
            byte[] material = NodeIdentity.newCommunitySecret();
            Path file = root.resolve("test.key");
            Files.write(file, material);
            KeyHandle handle = new KeyHandle("test", material.clone(), file);

            KeyEraser.secureErase(handle);

            Assertions.assertTrue(handle.isErased());
            Assertions.assertArrayEquals(new byte[material.length], handle.backingArray());
            Assertions.assertFalse(Files.exists(file));
            Assertions.assertThrows(IllegalStateException.class, handle::material);
            KeyEraser.secureErase(handle);
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void wipedIdentityCanNoLongerSignAndLosesKeyFiles() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-wipe-");
        try {
            NodeIdentity identity = NodeIdentity.loadOrCreate(root);
            Assertions.assertTrue(Files.exists(root.resolve(NodeIdentity.SIGNING_KEY_FILE)));

            identity.wipe();

            Assertions.assertTrue(identity.isWiped());
            Assertions.assertFalse(Files.exists(root.resolve(NodeIdentity.SIGNING_KEY_FILE)));
            Assertions.assertFalse(Files.exists(root.resolve(NodeIdentity.BOX_KEY_FILE)));
            Assertions.assertTrue(Files.exists(root.resolve(NodeIdentity.COMMUNITY_KEY_FILE)));
            Assertions.assertThrows(IllegalStateException.class, () -> identity.sign(new byte[]{1}));
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void identityIsStableAcrossReloads() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-identity-");
        try {
            String first = NodeIdentity.loadOrCreate(root).address();
            String second = NodeIdentity.loadOrCreate(root).address();
            Assertions.assertEquals(first, second);
            Assertions.assertEquals(64, first.length());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }
}
