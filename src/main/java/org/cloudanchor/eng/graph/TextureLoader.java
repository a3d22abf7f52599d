package org.cloudanchor.eng.graph;

import org.cloudanchor.eng.assets.*;
import org.lwjgl.opengl.GL;
import org.lwjgl.system.*;
import org.tinylog.Logger;

import java.nio.*;
import java.util.Optional;

import static org.lwjgl.opengl.GL11.*;
import static org.lwjgl.stb.STBImage.*;

public class TextureLoader {

    private static final int RGBA_CHANNELS = 4;

    private TextureLoader() {
        // Utility class
    }

    /**
     * Decodes a PNG (or any format STB understands) into RGBA8 pixels.
     *
     * @param encoded encoded image bytes
     * @return the decoded image, or empty if the data could not be decoded
     */
    public static Optional<ImageData> decodePng(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return Optional.empty();
        }
        ByteBuffer encodedBuf = MemoryUtil.memAlloc(encoded.length);
        try (MemoryStack stack = MemoryStack.stackPush()) {
            encodedBuf.put(encoded).flip();
            IntBuffer w = stack.mallocInt(1);
            IntBuffer h = stack.mallocInt(1);
            IntBuffer channels = stack.mallocInt(1);

            ByteBuffer pixels = stbi_load_from_memory(encodedBuf, w, h, channels, RGBA_CHANNELS);
            if (pixels == null) {
                Logger.error("Image not decoded: {}", stbi_failure_reason());
                return Optional.empty();
            }
            return Optional.of(new ImageData(pixels, w.get(0), h.get(0)));
        } finally {
            MemoryUtil.memFree(encodedBuf);
        }
    }

    /**
     * Loads a PNG asset and uploads it to the given texture target. Must be called from the thread that owns the
     * current GL context, since it issues GL calls.
     *
     * @param mgr    asset manager holding the image
     * @param target GL texture target the image is assigned to, with the texture already bound
     * @param path   path of the image, relative to the assets root
     * @return true if the image was loaded and uploaded, false otherwise
     */
    public static boolean loadPng(AssetManager mgr, int target, String path) {
        if (!hasCurrentContext()) {
            Logger.error("No GL context current on thread [{}], cannot load [{}]", Thread.currentThread().getName(),
                    path);
            return false;
        }
        Optional<byte[]> encoded = AssetUtils.loadBytes(mgr, path);
        if (encoded.isEmpty()) {
            return false;
        }
        Optional<ImageData> decoded = decodePng(encoded.get());
        if (decoded.isEmpty()) {
            Logger.error("Could not decode image [{}]", path);
            return false;
        }
        try (ImageData imageData = decoded.get()) {
            glPixelStorei(GL_UNPACK_ALIGNMENT, 1);
            glTexImage2D(target, 0, GL_RGBA, imageData.getWidth(), imageData.getHeight(), 0, GL_RGBA,
                    GL_UNSIGNED_BYTE, imageData.getPixels());
            GlUtils.checkGlError("glTexImage2D");
            Logger.debug("Loaded image [{}] {}x{}", path, imageData.getWidth(), imageData.getHeight());
        }
        return true;
    }

    private static boolean hasCurrentContext() {
        try {
            GL.getCapabilities();
            return true;
        } catch (IllegalStateException excp) {
            return false;
        } catch (LinkageError excp) {
            // No OpenGL library on this host, GL fails to initialize
            Logger.error("OpenGL is not available: {}", excp.toString());
            return false;
        }
    }
}
