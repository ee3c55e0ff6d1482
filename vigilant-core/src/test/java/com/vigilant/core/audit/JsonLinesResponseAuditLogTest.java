package com.vigilant.core.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonLinesResponseAuditLog")
class JsonLinesResponseAuditLogTest {

    private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should write one JSON object per line with ISO timestamps")
    void shouldWriteJsonLines() throws IOException {
        JsonLinesResponseAuditLog auditLog = new JsonLinesResponseAuditLog(dir.resolve("audit/responses.jsonl"));

        auditLog.append(new AuditEntry(ResponseAuditLog.IP_BLOCK, "event-1-credential_attack", "inc-1", AT,
                Map.of("target", "ip:203.0.113.7")));
        auditLog.append(new AuditEntry(ResponseAuditLog.RESPONSE_EXECUTED, "event-1-credential_attack", "inc-1", AT,
                Map.of("success", true)));

        List<String> lines = Files.readAllLines(auditLog.getFile(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{").contains("\"2024-03-01T12:00:00Z\"").contains("ip:203.0.113.7");
    }

    @Test
    @DisplayName("Should read recent entries back oldest first")
    void shouldReadRecentEntries() {
        JsonLinesResponseAuditLog auditLog = new JsonLinesResponseAuditLog(dir.resolve("responses.jsonl"));
        for (int i = 0; i < 5; i++) {
            auditLog.append(new AuditEntry(ResponseAuditLog.ACCOUNT_LOCK, "threat-" + i, null, AT.plusSeconds(i),
                    Map.of("sequence", i)));
        }

        List<AuditEntry> recent = auditLog.recent(2);

        assertThat(recent).extracting(AuditEntry::getThreatId).containsExactly("threat-3", "threat-4");
        assertThat(recent.get(1).getTimestamp()).isEqualTo(AT.plusSeconds(4));
        assertThat(recent.get(1).getDetails()).containsEntry("sequence", 4);
    }

    @Test
    @DisplayName("Should skip lines that are not valid JSON")
    void shouldSkipCorruptLines() throws IOException {
        Path file = dir.resolve("responses.jsonl");
        JsonLinesResponseAuditLog auditLog = new JsonLinesResponseAuditLog(file);
        auditLog.append(new AuditEntry(ResponseAuditLog.RESTRICTION, "t-1", null, AT, Map.of()));
        Files.writeString(file, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        auditLog.append(new AuditEntry(ResponseAuditLog.RESTRICTION, "t-2", null, AT, Map.of()));

        assertThat(auditLog.recent(10)).extracting(AuditEntry::getThreatId).containsExactly("t-1", "t-2");
    }

    @Test
    @DisplayName("Should return nothing before the first write")
    void shouldHandleMissingFile() {
        assertThat(new JsonLinesResponseAuditLog(dir.resolve("absent.jsonl")).recent(10)).isEmpty();
    }
}
