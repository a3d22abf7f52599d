package org.cloudanchor.eng.graph;

import java.nio.ByteBuffer;

import static org.lwjgl.stb.STBImage.stbi_image_free;

/**
 * Decoded RGBA8 image owned by STB. Must be closed to release the pixel buffer.
 */
public class ImageData implements AutoCloseable {

    private final int height;
    private final int width;
    private ByteBuffer pixels;

    ImageData(ByteBuffer pixels, int width, int height) {
        this.pixels = pixels;
        this.width = width;
        this.height = height;
    }

    @Override
    public void close() {
        if (pixels != null) {
            stbi_image_free(pixels);
            pixels = null;
        }
    }

    public int getHeight() {
        return height;
    }

    public ByteBuffer getPixels() {
        if (pixels == null) {
            throw new IllegalStateException("Image data already released");
        }
        return pixels;
    }

    public int getWidth() {
        return width;
    }
}
