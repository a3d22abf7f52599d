package org.cloudanchor.eng.room;

import org.cloudanchor.eng.ui.UiBridge;
import org.tinylog.Logger;

/**
 * Keeps the room code of this client and shares hosted anchor ids through a {@link RoomStore}. All operations are
 * fire-and-forget: failures are logged, never reported to the caller.
 */
public class RoomCodeManager {

    private final RoomStore roomStore;
    private Long listenedRoomCode;
    private Long roomCode;
    private RoomListener roomListener;

    public RoomCodeManager(RoomStore roomStore) {
        this.roomStore = roomStore;
    }

    public synchronized Long getRoomCode() {
        return roomCode;
    }

    private synchronized void clearRoomListener() {
        if (roomListener != null) {
            roomStore.removeRoomListener(listenedRoomCode, roomListener);
            roomListener = null;
            listenedRoomCode = null;
        }
    }

    /**
     * Waits for an anchor to be hosted in a room. Replaces the listener of any room listened to before.
     */
    public void listenForRoom(long code, RoomListener listener) {
        try {
            synchronized (this) {
                clearRoomListener();
                roomCode = code;
                listenedRoomCode = code;
                roomListener = listener;
            }
            UiBridge.setRoomCodeText(String.valueOf(code));
            roomStore.registerRoomListener(code, listener);
        } catch (RuntimeException excp) {
            Logger.warn(excp, "Could not listen for room [{}]", code);
        }
    }

    /**
     * Stores a hosted cloud anchor id in the current room, if there is one.
     */
    public void maybeUpdate(String cloudAnchorId) {
        Long code = getRoomCode();
        if (code == null || cloudAnchorId == null || cloudAnchorId.isEmpty()) {
            Logger.info("Not storing anchor id, room code: [{}], anchor id: [{}]", code, cloudAnchorId);
            return;
        }
        try {
            roomStore.storeAnchorIdInRoom(code, cloudAnchorId);
            UiBridge.displayMessageOnLowerSnackbar("Cloud anchor was hosted and stored in room " + code + ".");
        } catch (RuntimeException excp) {
            Logger.warn(excp, "Could not store anchor [{}] in room [{}]", cloudAnchorId, code);
        }
    }

    public synchronized void reset() {
        try {
            clearRoomListener();
        } catch (RuntimeException excp) {
            Logger.warn(excp, "Could not remove listener of room [{}]", listenedRoomCode);
            roomListener = null;
            listenedRoomCode = null;
        }
        roomCode = null;
    }

    /**
     * Updates the room code of this client and its label.
     *
     * @param getNewRoomCode      if true a new code is taken from the store
     * @param optionalNewRoomCode the code to use when {@code getNewRoomCode} is false
     */
    public void updateRoomCode(boolean getNewRoomCode, long optionalNewRoomCode) {
        long code;
        try {
            code = getNewRoomCode ? roomStore.newRoomCode() : optionalNewRoomCode;
        } catch (RuntimeException excp) {
            Logger.warn(excp, "Could not get a new room code");
            return;
        }
        synchronized (this) {
            roomCode = code;
        }
        Logger.info("Room code is now [{}]", code);
        UiBridge.setRoomCodeText(String.valueOf(code));
    }
}
