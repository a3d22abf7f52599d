package org.cloudanchor.eng;

import org.tinylog.Logger;

import java.io.*;
import java.util.Properties;

public class EngCfg {
    private static final String DEFAULT_ASSETS_DIR = "assets";
    private static final long DEFAULT_FIRST_ROOM_CODE = 1;
    private static final String DEFAULT_ROOM_STORE_FILE = "rooms.json";
    private static final String FILENAME = "eng.properties";
    private static EngCfg instance;

    private String assetsDir;
    private long firstRoomCode;
    private boolean logMatrices;
    private String roomStoreFile;

    private EngCfg() {
        // Singleton
        var props = new Properties();
        assetsDir = DEFAULT_ASSETS_DIR;
        roomStoreFile = DEFAULT_ROOM_STORE_FILE;
        firstRoomCode = DEFAULT_FIRST_ROOM_CODE;

        try (InputStream stream = EngCfg.class.getResourceAsStream("/" + FILENAME)) {
            if (stream == null) {
                throw new FileNotFoundException(FILENAME);
            }
            props.load(stream);
            assetsDir = props.getOrDefault("assetsDir", DEFAULT_ASSETS_DIR).toString();
            roomStoreFile = props.getOrDefault("roomStoreFile", DEFAULT_ROOM_STORE_FILE).toString();
            firstRoomCode = Long.parseLong(props.getOrDefault("firstRoomCode", DEFAULT_FIRST_ROOM_CODE).toString());
            logMatrices = Boolean.parseBoolean(props.getOrDefault("logMatrices", false).toString());
        } catch (IOException excp) {
            Logger.error("Could not read [{}] properties file", FILENAME, excp);
        }
    }

    public static synchronized EngCfg getInstance() {
        if (instance == null) {
            instance = new EngCfg();
        }
        return instance;
    }

    public String getAssetsDir() {
        return assetsDir;
    }

    public long getFirstRoomCode() {
        return firstRoomCode;
    }

    public String getRoomStoreFile() {
        return roomStoreFile;
    }

    public boolean isLogMatrices() {
        return logMatrices;
    }
}
