package com.datcoord.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ContributionAuditLog {
    private static final Logger log = LoggerFactory.getLogger(ContributionAuditLog.class);
    static final String GENESIS_HASH = "0".repeat(64);

    private static final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private final Path auditLogPath;
    private String lastHash;

    public ContributionAuditLog(Path auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    public Path path() {
        return auditLogPath;
    }

    public ContributionAuditEntry recordFinalize(long timestamp, long modelVersion, String weightsRef,
            String caller, Map<String, Long> credits) throws IOException {
        return append(new ContributionAuditEntry(timestamp, ContributionAuditEntry.FINALIZE, modelVersion,
                weightsRef, caller, new TreeMap<>(credits), null, null));
    }

    public ContributionAuditEntry recordAward(long timestamp, String admin, String identity, long amount) throws IOException {
        return append(new ContributionAuditEntry(timestamp, ContributionAuditEntry.AWARD, null,
                null, admin, new TreeMap<>(Map.of(identity, amount)), null, null));
    }

    public synchronized ContributionAuditEntry append(ContributionAuditEntry entry) throws IOException {
        if (lastHash == null) {
            lastHash = readLastHash();
        }
        String hash = hash(lastHash, entry.chained(lastHash, null));
        ContributionAuditEntry chained = entry.chained(lastHash, hash);
        if (auditLogPath.getParent() != null) {
            Files.createDirectories(auditLogPath.getParent());
        }
        String line = mapper.writeValueAsString(chained) + System.lineSeparator();
        Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        lastHash = hash;
        log.debug("audit.appended event={} version={} hash={}", entry.event(), entry.modelVersion(), hash);
        return chained;
    }

    public List<ContributionAuditEntry> readAll() throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<ContributionAuditEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(auditLogPath, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, ContributionAuditEntry.class));
        }
        return entries;
    }

    public static AuditVerification verify(Path auditLogPath) throws IOException {
        if (!Files.exists(auditLogPath)) {
            return AuditVerification.ok(0);
        }
        List<String> lines = Files.readAllLines(auditLogPath, StandardCharsets.UTF_8);
        String previous = GENESIS_HASH;
        int entries = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            entries++;
            ContributionAuditEntry entry;
            try {
                entry = mapper.readValue(line, ContributionAuditEntry.class);
            } catch (JsonProcessingException e) {
                return AuditVerification.broken(entries, i + 1, "unparseable entry: " + e.getOriginalMessage());
            }
            if (!previous.equals(entry.previousHash())) {
                return AuditVerification.broken(entries, i + 1, "previousHash does not match the preceding entry");
            }
            String expected = hash(previous, entry.unhashed());
            if (!expected.equals(entry.entryHash())) {
                return AuditVerification.broken(entries, i + 1, "entryHash does not match the entry content");
            }
            previous = entry.entryHash();
        }
        return AuditVerification.ok(entries);
    }

    private String readLastHash() throws IOException {
        List<ContributionAuditEntry> existing = readAll();
        if (existing.isEmpty()) {
            return GENESIS_HASH;
        }
        return existing.get(existing.size() - 1).entryHash();
    }

    static String hash(String previousHash, ContributionAuditEntry unhashed) throws JsonProcessingException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
            digest.update(mapper.writeValueAsBytes(unhashed));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
