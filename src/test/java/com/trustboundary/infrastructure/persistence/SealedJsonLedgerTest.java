package com.trustboundary.infrastructure.persistence;

import com.trustboundary.domain.model.Seal;
import com.trustboundary.infrastructure.crypto.CanonicalJson;
import com.trustboundary.support.FakeSealService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SealedJsonLedgerTest {

    @TempDir
    Path dir;

    private Path file;
    private FakeSealService sealService;

    @BeforeEach
    void setUp() {
        file = dir.resolve("seals.json");
        sealService = new FakeSealService();
    }

    private SealedJsonLedger<Seal> ledger(FakeSealService seals) {
        return new SealedJsonLedger<>(file, "seals", Seal.class, Seal::getSealId, new CanonicalJson(), seals);
    }

    private static Seal seal(String id, String data) {
        return Seal.builder().sealId(id).data(data).signature("sig-" + id).build();
    }

    @Test
    void missingFileIsEmptyLedger() {
        SealedJsonLedger<Seal> ledger = ledger(sealService);

        ledger.load(true);

        assertEquals(0, ledger.size());
        assertFalse(Files.exists(file));
    }

    @Test
    void reloadedLedgerRewritesIdenticalBytes() throws IOException {
        SealedJsonLedger<Seal> ledger = ledger(sealService);
        ledger.put(seal("s2", "second"));
        ledger.put(seal("s1", "first"));
        byte[] written = Files.readAllBytes(file);

        SealedJsonLedger<Seal> reloaded = ledger(sealService);
        reloaded.load(true);
        reloaded.put(reloaded.find("s1").orElseThrow());

        assertArrayEquals(written, Files.readAllBytes(file));
        assertEquals(List.of("s1", "s2"), reloaded.all().stream().map(Seal::getSealId).toList());
    }

    @Test
    void editedFileIsDetectedOnLoad() throws IOException {
        ledger(sealService).put(seal("s1", "original"));
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content.replace("original", "altered"), StandardCharsets.UTF_8);

        SealedJsonLedger<Seal> tampered = ledger(sealService);
        LedgerTamperedException thrown = assertThrows(LedgerTamperedException.class, () -> tampered.load(true));
        assertEquals(file, thrown.getFile());

        SealedJsonLedger<Seal> trusting = ledger(sealService);
        trusting.load(false);
        assertEquals("altered", trusting.find("s1").orElseThrow().getData());
    }

    @Test
    void unparseableFileIsPersistenceFailure() throws IOException {
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        assertThrows(PersistenceException.class, () -> ledger(sealService).load(false));
    }

    @Test
    void failedWriteRollsBackMemory() {
        FailingSealService failing = new FailingSealService();
        SealedJsonLedger<Seal> ledger = ledger(failing);
        ledger.put(seal("s1", "original"));
        failing.failNextCreate = true;

        assertThrows(PersistenceException.class, () -> ledger.put(seal("s1", "replacement")));
        failing.failNextCreate = true;
        assertThrows(PersistenceException.class, () -> ledger.put(seal("s2", "new")));

        assertEquals("original", ledger.find("s1").orElseThrow().getData());
        assertFalse(ledger.contains("s2"));
        assertEquals(1, ledger.size());
    }

    @Test
    void appendRefusesDuplicates() {
        SealedJsonLedger<Seal> ledger = ledger(sealService);
        ledger.append(seal("s1", "first"));

        assertThrows(IllegalStateException.class, () -> ledger.append(seal("s1", "again")));
        assertEquals("first", ledger.find("s1").orElseThrow().getData());
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws IOException {
        SealedJsonLedger<Seal> ledger = ledger(sealService);
        ledger.put(seal("s1", "first"));
        ledger.put(seal("s2", "second"));

        try (var entries = Files.list(dir)) {
            assertEquals(List.of(file), entries.toList());
        }
        assertTrue(Files.readString(file).contains("\"seal\""));
    }

    private static class FailingSealService extends FakeSealService {
        boolean failNextCreate;

        @Override
        public String create(String content) {
            if (failNextCreate) {
                failNextCreate = false;
                throw new IllegalStateException("seal backend unavailable");
            }
            return super.create(content);
        }
    }
}
