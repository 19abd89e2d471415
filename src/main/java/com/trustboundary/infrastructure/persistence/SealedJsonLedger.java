package com.trustboundary.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.infrastructure.crypto.SealService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Function;

/**
 * File-backed record store sealed as a whole.
 *
 * <p>The file is a single JSON document {@code {"<records-field>": {id: record, ...}, "seal": "..."}}
 * where the seal covers the canonical rendering of the records map. Every write
 * rewrites the document through a temporary file and an atomic rename, so a
 * crash leaves either the old or the new document on disk.
 *
 * <p>Records are deep-copied on the way in and out; callers can never alter
 * stored state by mutating an object they hold. Reads are lock-free and may
 * observe a write in progress; writes are serialized.
 *
 * @param <T> record type
 */
@Slf4j
public class SealedJsonLedger<T> {

    private static final String SEAL_FIELD = "seal";

    private final Path file;
    private final String recordsField;
    private final Class<T> type;
    private final Function<T, String> idOf;
    private final CanonicalJson json;
    private final SealService sealService;
    private final NavigableMap<String, T> records = new ConcurrentSkipListMap<>();
    private final Object writeLock = new Object();

    public SealedJsonLedger(Path file, String recordsField, Class<T> type, Function<T, String> idOf,
                            CanonicalJson json, SealService sealService) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.recordsField = Objects.requireNonNull(recordsField, "recordsField must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.idOf = Objects.requireNonNull(idOf, "idOf must not be null");
        this.json = Objects.requireNonNull(json, "json must not be null");
        this.sealService = Objects.requireNonNull(sealService, "sealService must not be null");
    }

    /**
     * Read the ledger file, replacing in-memory state. A missing file is an empty ledger.
     *
     * @param verifySeal re-check the stored seal against the loaded records
     * @throws LedgerTamperedException if {@code verifySeal} is set and the seal does not match
     * @throws PersistenceException if the file cannot be read or parsed
     */
    public void load(boolean verifySeal) {
        synchronized (writeLock) {
            records.clear();
            if (!Files.exists(file)) {
                log.info("No ledger at {}, starting empty", file);
                return;
            }

            JsonNode document;
            try {
                document = json.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new PersistenceException("Cannot read ledger " + file, e);
            }

            JsonNode recordsNode = document.path(recordsField);
            if (verifySeal) {
                String seal = document.path(SEAL_FIELD).asText(null);
                if (seal == null || !sealService.verify(json.write(recordsNode), seal)) {
                    log.error("Ledger seal mismatch for {}", file);
                    throw new LedgerTamperedException(file);
                }
            }

            Iterator<Map.Entry<String, JsonNode>> fields = recordsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                try {
                    records.put(entry.getKey(), json.mapper().treeToValue(entry.getValue(), type));
                } catch (JsonProcessingException e) {
                    records.clear();
                    throw new PersistenceException("Corrupt record " + entry.getKey() + " in " + file, e);
                }
            }
            log.info("Loaded {} {} from {}", records.size(), recordsField, file);
        }
    }

    public Optional<T> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(json.copy(records.get(id), type));
    }

    /**
     * Every record, ordered by id.
     */
    public List<T> all() {
        return records.values().stream().map(record -> json.copy(record, type)).toList();
    }

    public boolean contains(String id) {
        return records.containsKey(id);
    }

    public long size() {
        return records.size();
    }

    /**
     * Insert or replace a record and flush the ledger.
     *
     * @throws PersistenceException if the flush fails; the previous record (or its
     *         absence) is restored first
     */
    public void put(T record) {
        String id = Objects.requireNonNull(idOf.apply(record), "record id must not be null");
        synchronized (writeLock) {
            T previous = records.put(id, json.copy(record, type));
            try {
                flush();
            } catch (IOException | RuntimeException e) {
                if (previous == null) {
                    records.remove(id);
                } else {
                    records.put(id, previous);
                }
                log.error("Ledger write failed for {} {}, rolled back", recordsField, id, e);
                throw new PersistenceException("Cannot write ledger " + file, e);
            }
        }
    }

    /**
     * Insert a record that must not exist yet.
     *
     * @throws IllegalStateException if a record with the same id is present
     */
    public void append(T record) {
        String id = Objects.requireNonNull(idOf.apply(record), "record id must not be null");
        synchronized (writeLock) {
            if (records.containsKey(id)) {
                throw new IllegalStateException("Record " + id + " already exists in " + recordsField);
            }
            put(record);
        }
    }

    private void flush() throws IOException {
        Map<String, T> snapshot = new TreeMap<>(records);
        // Seal over the same tree the loader will see
        JsonNode recordsNode = json.mapper().valueToTree(snapshot);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(recordsField, recordsNode);
        document.put(SEAL_FIELD, sealService.create(json.write(recordsNode)));

        Path directory = file.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, json.writePretty(document), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
