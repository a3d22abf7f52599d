package org.cloudanchor.eng.assets;

import java.io.*;

/**
 * Read-only access to the application's packaged assets. Asset names are relative paths using '/' as separator.
 */
public interface AssetManager {

    /**
     * Opens the named asset.
     *
     * @param fileName path of the asset, relative to the assets root
     * @return a stream over the asset contents, to be closed by the caller
     * @throws IOException if the asset does not exist or cannot be opened
     */
    InputStream open(String fileName) throws IOException;
}
