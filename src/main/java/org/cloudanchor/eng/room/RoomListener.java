package org.cloudanchor.eng.room;

@FunctionalInterface
public interface RoomListener {

    void onCloudAnchorIdAvailable(long roomCode, String cloudAnchorId);
}
