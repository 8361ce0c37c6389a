package com.datcoord.audit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContributionAuditLogTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldChainEntriesFromGenesis() throws Exception {
        Path path = tempDir.resolve("audit/contributions.jsonl");
        ContributionAuditLog auditLog = new ContributionAuditLog(path);

        ContributionAuditEntry first = auditLog.recordFinalize(4, 1, "sha256:w1", "0xowner",
                Map.of("0xbob", 10L, "0xalice", 10L));
        ContributionAuditEntry second = auditLog.recordAward(5, "admin", "0xbob", 3);

        assertEquals(ContributionAuditLog.GENESIS_HASH, first.previousHash());
        assertEquals(first.entryHash(), second.previousHash());
        assertEquals(List.of(first, second), auditLog.readAll());
        assertEquals(AuditVerification.ok(2), ContributionAuditLog.verify(path));
    }

    @Test
    void shouldContinueChainAcrossInstances() throws Exception {
        Path path = tempDir.resolve("contributions.jsonl");
        ContributionAuditEntry first = new ContributionAuditLog(path).recordAward(1, "admin", "0xbob", 3);

        ContributionAuditEntry second = new ContributionAuditLog(path).recordAward(2, "admin", "0xcarol", 4);

        assertEquals(first.entryHash(), second.previousHash());
        assertTrue(ContributionAuditLog.verify(path).intact());
    }

    @Test
    void shouldDetectEditedEntry() throws Exception {
        Path path = tempDir.resolve("contributions.jsonl");
        ContributionAuditLog auditLog = new ContributionAuditLog(path);
        auditLog.recordFinalize(4, 1, "sha256:w1", "0xowner", Map.of("0xbob", 10L));
        auditLog.recordFinalize(9, 2, "sha256:w2", "0xowner", Map.of("0xbob", 10L));

        List<String> lines = Files.readAllLines(path);
        lines.set(0, lines.get(0).replace("\"0xbob\":10", "\"0xbob\":1000"));
        Files.write(path, lines);

        AuditVerification verification = ContributionAuditLog.verify(path);
        assertFalse(verification.intact());
        assertEquals(1, verification.firstBrokenLine());
    }

    @Test
    void shouldDetectDroppedEntry() throws Exception {
        Path path = tempDir.resolve("contributions.jsonl");
        ContributionAuditLog auditLog = new ContributionAuditLog(path);
        auditLog.recordAward(1, "admin", "0xa", 1);
        auditLog.recordAward(2, "admin", "0xb", 1);
        auditLog.recordAward(3, "admin", "0xc", 1);

        List<String> lines = Files.readAllLines(path);
        lines.remove(1);
        Files.write(path, lines);

        AuditVerification verification = ContributionAuditLog.verify(path);
        assertFalse(verification.intact());
        assertEquals(2, verification.firstBrokenLine());
    }

    @Test
    void shouldTreatMissingLogAsEmptyAndIntact() throws Exception {
        assertEquals(AuditVerification.ok(0), ContributionAuditLog.verify(tempDir.resolve("absent.jsonl")));
    }
}
