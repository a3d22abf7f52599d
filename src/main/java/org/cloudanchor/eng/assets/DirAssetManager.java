package org.cloudanchor.eng.assets;

import java.io.*;
import java.nio.file.*;

public class DirAssetManager implements AssetManager {

    private final Path root;

    public DirAssetManager(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public InputStream open(String fileName) throws IOException {
        Path path = root.resolve(fileName).normalize();
        if (!path.startsWith(root)) {
            throw new FileNotFoundException("Asset outside of assets root [" + fileName + "]");
        }
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Asset not found [" + path + "]");
        }
        return Files.newInputStream(path);
    }
}
