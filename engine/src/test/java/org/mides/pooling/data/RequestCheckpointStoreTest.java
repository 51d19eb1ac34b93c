package org.mides.pooling.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mides.pooling.RequestFixtures;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RequestCheckpointStoreTest {

    @TempDir
    Path tempDir;

    private final RequestCheckpointStore store = new RequestCheckpointStore(new ObjectMapper());

    @Test
    void saveThenLoad_shouldRestoreRequests() {
        var requests = RequestFixtures.compatibleTrio();
        var path = tempDir.resolve("checkpoints/requests.json");

        store.save(path, requests);
        var loaded = store.load(path);

        assertTrue(store.exists(path));
        assertEquals(requests.size(), loaded.size());
        for (int i = 0; i < requests.size(); i++) {
            var expected = requests.get(i);
            var actual = loaded.get(i);
            assertEquals(expected.getId(), actual.getId());
            assertEquals(expected.getPickupWindow(), actual.getPickupWindow());
            assertEquals(expected.getDropoffWindow(), actual.getDropoffWindow());
            assertEquals(expected.getPickup(), actual.getPickup());
            assertEquals(expected.getDropoff(), actual.getDropoff());
            assertEquals(expected.getDirectTravelTime(), actual.getDirectTravelTime());
            assertEquals(expected.getDirectFare(), actual.getDirectFare(), 1e-9);
        }
    }

    @Test
    void save_shouldWriteClockTimes() throws Exception {
        var path = tempDir.resolve("requests.json");

        store.save(path, RequestFixtures.compatibleTrio());

        var json = Files.readString(path);
        assertTrue(json.contains("\"start\" : \"07:45:00\""), json);
        assertTrue(json.contains("\"pickup_window\""));
    }

    @Test
    void load_missingFile_shouldThrowUncheckedIOException() {
        var path = tempDir.resolve("absent.json");

        assertFalse(store.exists(path));
        assertThrows(UncheckedIOException.class, () -> store.load(path));
    }
}
