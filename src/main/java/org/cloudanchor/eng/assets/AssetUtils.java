package org.cloudanchor.eng.assets;

import org.tinylog.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class AssetUtils {

    private AssetUtils() {
        // Utility class
    }

    /**
     * Reads a whole asset into memory.
     *
     * @param mgr      asset manager to read from
     * @param fileName path of the asset, relative to the assets root
     * @return the asset bytes, or empty if the asset is missing or could not be read
     */
    public static Optional<byte[]> loadBytes(AssetManager mgr, String fileName) {
        if (mgr == null || fileName == null) {
            Logger.error("Asset manager and file name are required");
            return Optional.empty();
        }
        try (InputStream stream = mgr.open(fileName)) {
            return Optional.of(stream.readAllBytes());
        } catch (IOException excp) {
            Logger.error("Could not load asset [{}]: {}", fileName, excp.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads a text asset, decoded as UTF-8.
     *
     * @param mgr      asset manager to read from
     * @param fileName path of the asset, relative to the assets root
     * @return the file text, or empty if the asset is missing or could not be read
     */
    public static Optional<String> loadTextFile(AssetManager mgr, String fileName) {
        return loadBytes(mgr, fileName).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
}
