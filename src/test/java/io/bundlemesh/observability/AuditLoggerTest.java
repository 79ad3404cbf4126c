package io.bundlemesh.observability;

import io.bundlemesh.TestBundles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {
    @Test
    void chainSurvivesReopenAndDetectsEditedRow() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("node.init", "node", "node/x", "ok", Map.of("capacity_bytes", 1024L)));
            logger.log(AuditLogger.AuditEvent.of("bundle.submit", "producer", "bundle/1", "accepted", Map.of("custody", true)));
            String head = logger.currentHash();

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("identity.wipe", "cli", "node/keys", "ok", null));

            AuditLogger.ChainCheck intact = reopened.verifyChain();
            Assertions.assertTrue(intact.intact(), intact.detail());
            Assertions.assertEquals(3, intact.rows());

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"accepted\"", "\"rejected\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.ChainCheck broken = reopened.verifyChain();
            Assertions.assertFalse(broken.intact());
            Assertions.assertEquals(2, broken.rows());
            Assertions.assertEquals("hash mismatch", broken.detail());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void removedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-audit-cut-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            for (int i = 0; i < 3; i++) {
                logger.log(AuditLogger.AuditEvent.of("secret.open", "cli", "secret/s" + i, "ok", Map.of()));
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.ChainCheck check = logger.verifyChain();
            Assertions.assertFalse(check.intact());
            Assertions.assertEquals("prev_hash mismatch", check.detail());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }
}
