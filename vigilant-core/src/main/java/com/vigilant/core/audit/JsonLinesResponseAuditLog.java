package com.vigilant.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Audit log written as one JSON object per line, so the file can be shipped by
 * any log collector.
 */
public class JsonLinesResponseAuditLog implements ResponseAuditLog {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesResponseAuditLog.class);

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesResponseAuditLog(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonLinesResponseAuditLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry to " + file, e);
        }
    }

    @Override
    public synchronized List<AuditEntry> recent(int limit) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + file, e);
        }
        List<AuditEntry> entries = new ArrayList<>();
        for (String line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(parse(mapper.readTree(line)));
            } catch (JsonProcessingException e) {
                log.warn("[Vigilant] Skipping unreadable audit line in {}: {}", file, e.getOriginalMessage());
            }
        }
        return entries;
    }

    private AuditEntry parse(JsonNode node) {
        Map<String, Object> details = node.hasNonNull("details")
                ? mapper.convertValue(node.get("details"), DETAILS_TYPE)
                : Map.of();
        return new AuditEntry(
                text(node, "kind"),
                text(node, "threatId"),
                text(node, "incidentId"),
                node.hasNonNull("timestamp") ? Instant.parse(node.get("timestamp").asText()) : null,
                details);
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
