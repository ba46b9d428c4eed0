package io.llmgate.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit trail kept as a single JSON array. Saves go through a sibling temp file and an atomic
 * rename so a crash never leaves a half-written trail behind.
 */
public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType listType;

    public FileAuditStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.listType = mapper.getTypeFactory().constructCollectionType(List.class, AuditEvent.class);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        if (!Files.isRegularFile(file) || Files.size(file) == 0) {
            return List.of();
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<AuditEvent> events = mapper.readValue(reader, listType);
            return events == null ? List.of() : events;
        } catch (JsonProcessingException e) {
            LOG.warn("Audit trail {} is unreadable, starting empty: {}", file, e.getOriginalMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void save(List<AuditEvent> events) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path staging = file.resolveSibling(file.getFileName() + ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, events);
        }
        Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
