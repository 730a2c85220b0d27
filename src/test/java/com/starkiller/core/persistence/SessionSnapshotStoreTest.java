package com.starkiller.core.persistence;

import com.starkiller.core.consequence.ConsequencePayload;
import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.model.DecisionCategory;
import com.starkiller.core.model.DecisionPressure;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.EndingPath;
import com.starkiller.core.model.NarrativeBranch;
import com.starkiller.core.session.SessionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SessionSnapshotStore}.
 */
class SessionSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private SessionSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new SessionSnapshotStore();
    }

    private static SessionSnapshot sampleSnapshot() {
        var record = new DecisionRecord("ENC-01-0001", Instant.parse("2026-03-01T10:15:30Z"), 5, 0,
                DecisionCategory.TACTICAL, DecisionPressure.MEDIUM, "Approved Imperial Shuttle", null);
        var token = new ConsequenceToken("CT-0001", "BRIBE_ACCEPTED", 1, 4,
                new ConsequencePayload(null, "Internal Affairs Reviews Checkpoint Irregularities", -1, 6, true),
                false, -1);
        return new SessionSnapshot("SKB-0000002A", 42L, 3, 5, 0, NarrativeBranch.NEUTRAL, 1,
                List.of("imperium"), List.of(record), "ENC-01-0001", 1, List.of(token),
                5, 0, 5, 0, EndingPath.NONE, List.of("THE_WEAPONS_INSPECTOR"), 0, 4, 1, 1, 120,
                5, List.of("Imperial Shuttle", "TIE Fighter"), 3, Map.of("imperial_standard", 2), 1,
                List.of("ENC-01-0001", "ENC-03-0005"));
    }

    @Test
    @DisplayName("a saved snapshot loads back unchanged")
    void roundTrip() {
        Path file = tempDir.resolve("saves/session.json");
        SessionSnapshot snapshot = sampleSnapshot();

        store.save(snapshot, file);
        SessionSnapshot loaded = store.load(file);

        assertEquals(snapshot, loaded);
        assertFalse(Files.exists(tempDir.resolve("saves/session.json.tmp")));
    }

    @Test
    @DisplayName("saving again replaces the previous snapshot")
    void overwrite() {
        Path file = tempDir.resolve("session.json");
        store.save(sampleSnapshot(), file);

        SessionSnapshot later = new SessionSnapshot("SKB-0000002A", 42L, 9, 0, 0, null, 0,
                List.of(), List.of(), null, 0, List.of(), 0, 0, 0, 0, EndingPath.NONE, List.of(), 0, 0, 0, 0, 0,
                0, List.of(), -1, Map.of(), 0, List.of());
        store.save(later, file);

        assertEquals(9, store.load(file).day());
    }

    @Test
    @DisplayName("loading a missing file fails")
    void missingFile() {
        var e = assertThrows(SnapshotStoreException.class, () -> store.load(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("nope.json"));
    }

    @Test
    @DisplayName("loading a corrupt file fails with the cause attached")
    void corruptFile() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"sessionId\": ");

        var e = assertThrows(SnapshotStoreException.class, () -> store.load(file));
        assertNotNull(e.getCause());
    }
}
