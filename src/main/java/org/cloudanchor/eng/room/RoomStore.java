package org.cloudanchor.eng.room;

import com.google.gson.*;
import org.cloudanchor.eng.EngCfg;
import org.tinylog.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Registry of rooms shared by the hosting and the resolving client. Room codes are handed out sequentially. When
 * created with a file the registry is kept in it as JSON after every change.
 */
public class RoomStore {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Map<Long, List<RoomListener>> listeners;
    private final Path path;
    private StoreData data;

    public RoomStore(long firstRoomCode) {
        this(firstRoomCode, null);
    }

    public RoomStore(long firstRoomCode, Path path) {
        this.path = path;
        listeners = new HashMap<>();
        data = load(path);
        if (data.lastRoomCode < firstRoomCode - 1) {
            data.lastRoomCode = firstRoomCode - 1;
        }
    }

    public static RoomStore fromConfig() {
        EngCfg engCfg = EngCfg.getInstance();
        return new RoomStore(engCfg.getFirstRoomCode(), Path.of(engCfg.getRoomStoreFile()));
    }

    private static StoreData load(Path path) {
        if (path == null || !Files.exists(path)) {
            return new StoreData();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            StoreData loaded = GSON.fromJson(reader, StoreData.class);
            if (loaded == null) {
                return new StoreData();
            }
            if (loaded.rooms == null) {
                loaded.rooms = new TreeMap<>();
            }
            return loaded;
        } catch (IOException | JsonParseException excp) {
            Logger.error(excp, "Could not read room store [{}], starting empty", path);
            return new StoreData();
        }
    }

    public synchronized Optional<String> getCloudAnchorId(long roomCode) {
        Room room = data.rooms.get(roomCode);
        return room != null ? Optional.ofNullable(room.hostedAnchorId) : Optional.empty();
    }

    public synchronized long getLastRoomCode() {
        return data.lastRoomCode;
    }

    /**
     * Allocates the next room code not used by any room, including rooms created by storing an anchor directly.
     */
    public synchronized long newRoomCode() {
        do {
            data.lastRoomCode++;
        } while (data.rooms.containsKey(data.lastRoomCode));
        data.rooms.put(data.lastRoomCode, new Room());
        save();
        Logger.debug("Allocated room code [{}]", data.lastRoomCode);
        return data.lastRoomCode;
    }

    /**
     * Registers a listener for the anchor hosted in a room. If the room already holds an anchor id the listener is
     * called right away.
     */
    public void registerRoomListener(long roomCode, RoomListener listener) {
        String existing;
        synchronized (this) {
            listeners.computeIfAbsent(roomCode, k -> new ArrayList<>()).add(listener);
            Room room = data.rooms.get(roomCode);
            existing = room != null ? room.hostedAnchorId : null;
        }
        if (existing != null) {
            listener.onCloudAnchorIdAvailable(roomCode, existing);
        }
    }

    public synchronized void removeRoomListener(long roomCode, RoomListener listener) {
        List<RoomListener> roomListeners = listeners.get(roomCode);
        if (roomListeners != null) {
            roomListeners.remove(listener);
        }
    }

    private void save() {
        if (path == null) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, GSON.toJson(data), StandardCharsets.UTF_8);
        } catch (IOException excp) {
            Logger.error(excp, "Could not write room store [{}]", path);
        }
    }

    public void storeAnchorIdInRoom(long roomCode, String cloudAnchorId) {
        List<RoomListener> toNotify;
        synchronized (this) {
            Room room = data.rooms.computeIfAbsent(roomCode, k -> new Room());
            room.hostedAnchorId = cloudAnchorId;
            room.updatedAtTimestamp = System.currentTimeMillis();
            save();
            toNotify = new ArrayList<>(listeners.getOrDefault(roomCode, Collections.emptyList()));
        }
        Logger.debug("Stored anchor [{}] in room [{}]", cloudAnchorId, roomCode);
        for (RoomListener listener : toNotify) {
            listener.onCloudAnchorIdAvailable(roomCode, cloudAnchorId);
        }
    }

    private static class Room {
        private String hostedAnchorId;
        private long updatedAtTimestamp;
    }

    private static class StoreData {
        private long lastRoomCode;
        private Map<Long, Room> rooms = new TreeMap<>();
    }
}
