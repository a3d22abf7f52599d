package org.cloudanchor.eng.room;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RoomStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void roomCodesAreSequential() {
        var store = new RoomStore(10);
        assertEquals(10, store.newRoomCode());
        assertEquals(11, store.newRoomCode());
        assertEquals(11, store.getLastRoomCode());
    }

    @Test
    void listenerIsNotifiedWhenAnchorIsStored() {
        var store = new RoomStore(1);
        long code = store.newRoomCode();
        List<String> received = new ArrayList<>();
        store.registerRoomListener(code, (roomCode, anchorId) -> received.add(roomCode + "=" + anchorId));

        assertTrue(received.isEmpty());
        store.storeAnchorIdInRoom(code, "ua-1234");

        assertEquals(List.of(code + "=ua-1234"), received);
        assertEquals(Optional.of("ua-1234"), store.getCloudAnchorId(code));
    }

    @Test
    void lateListenerGetsExistingAnchor() {
        var store = new RoomStore(1);
        store.storeAnchorIdInRoom(5, "ua-5");
        List<String> received = new ArrayList<>();
        store.registerRoomListener(5, (roomCode, anchorId) -> received.add(anchorId));
        assertEquals(List.of("ua-5"), received);
    }

    @Test
    void removedListenerIsNotNotified() {
        var store = new RoomStore(1);
        List<String> received = new ArrayList<>();
        RoomListener listener = (roomCode, anchorId) -> received.add(anchorId);
        store.registerRoomListener(3, listener);
        store.removeRoomListener(3, listener);
        store.storeAnchorIdInRoom(3, "ua-3");
        assertTrue(received.isEmpty());
    }

    @Test
    void otherRoomsAreNotNotified() {
        var store = new RoomStore(1);
        List<String> received = new ArrayList<>();
        store.registerRoomListener(1, (roomCode, anchorId) -> received.add(anchorId));
        store.storeAnchorIdInRoom(2, "ua-2");
        assertTrue(received.isEmpty());
        assertTrue(store.getCloudAnchorId(1).isEmpty());
    }

    @Test
    void persistsToFile() {
        Path file = tempDir.resolve("data/rooms.json");
        var store = new RoomStore(1, file);
        long code = store.newRoomCode();
        store.storeAnchorIdInRoom(code, "ua-persisted");
        assertTrue(Files.exists(file));

        var reloaded = new RoomStore(1, file);
        assertEquals(code, reloaded.getLastRoomCode());
        assertEquals(Optional.of("ua-persisted"), reloaded.getCloudAnchorId(code));
        assertEquals(code + 1, reloaded.newRoomCode());
    }

    @Test
    void corruptFileStartsEmpty() throws IOException {
        Path file = tempDir.resolve("rooms.json");
        Files.writeString(file, "{ not json");
        var store = new RoomStore(1, file);
        assertEquals(0, store.getLastRoomCode());
        assertEquals(1, store.newRoomCode());
    }

    @Test
    void configuredStoreStartsAtFirstRoomCode() {
        var store = RoomStore.fromConfig();
        assertTrue(store.getLastRoomCode() >= 0);
    }

    @Test
    void newRoomCodeSkipsExistingRooms() {
        var store = new RoomStore(1);
        store.storeAnchorIdInRoom(1, "ua-existing");

        assertEquals(2, store.newRoomCode());
        assertEquals(Optional.of("ua-existing"), store.getCloudAnchorId(1));
    }

    @Test
    void newRoomCodeSkipsRoomsAheadOfLoadedCounter() throws IOException {
        Path file = tempDir.resolve("lagging.json");
        Files.writeString(file, "{\"lastRoomCode\": 0, \"rooms\": {\"1\": {\"hostedAnchorId\": \"ua-file\"}, " +
                "\"2\": {}}}");
        var store = new RoomStore(1, file);

        assertEquals(3, store.newRoomCode());
        assertEquals(Optional.of("ua-file"), store.getCloudAnchorId(1));
    }
}
