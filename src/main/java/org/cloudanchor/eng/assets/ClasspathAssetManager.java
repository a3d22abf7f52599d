package org.cloudanchor.eng.assets;

import java.io.*;

public class ClasspathAssetManager implements AssetManager {

    private final String prefix;

    public ClasspathAssetManager(String root) {
        String trimmed = root.replaceAll("^/+|/+$", "");
        prefix = trimmed.isEmpty() ? "/" : "/" + trimmed + "/";
    }

    @Override
    public InputStream open(String fileName) throws IOException {
        String resource = prefix + fileName;
        InputStream stream = ClasspathAssetManager.class.getResourceAsStream(resource);
        if (stream == null) {
            throw new FileNotFoundException("Asset not found in classpath [" + resource + "]");
        }
        return stream;
    }
}
