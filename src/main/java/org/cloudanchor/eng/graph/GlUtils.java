package org.cloudanchor.eng.graph;

import org.lwjgl.opengl.GL11;
import org.tinylog.Logger;

import java.util.*;
import java.util.function.IntSupplier;

import static org.lwjgl.opengl.GL30.*;

public class GlUtils {

    // glGetError may keep reporting on a lost context
    private static final int MAX_ERRORS = 32;

    private GlUtils() {
        // Utility class
    }

    public static void check(boolean condition, String message) {
        if (!condition) {
            Logger.error("*** CHECK FAILED: {}", message);
            throw new GlException("Check failed: " + message);
        }
    }

    /**
     * Checks the GL error flags and fails if any is set.
     *
     * @param operation the name of the GL call that was just issued
     * @throws GlException if at least one GL error was pending
     */
    public static void checkGlError(String operation) {
        checkGlError(operation, GL11::glGetError);
    }

    static void checkGlError(String operation, IntSupplier errorSource) {
        List<String> errors = new ArrayList<>();
        for (int error = errorSource.getAsInt(); error != GL_NO_ERROR && errors.size() < MAX_ERRORS;
             error = errorSource.getAsInt()) {
            String errorName = errorName(error);
            Logger.error("after {}() glError ({})", operation, errorName);
            errors.add(errorName);
        }
        if (!errors.isEmpty()) {
            throw new GlException("GL error after " + operation + "(): " + String.join(", ", errors));
        }
    }

    public static String errorName(int error) {
        return switch (error) {
            case GL_NO_ERROR -> "GL_NO_ERROR";
            case GL_INVALID_ENUM -> "GL_INVALID_ENUM";
            case GL_INVALID_VALUE -> "GL_INVALID_VALUE";
            case GL_INVALID_OPERATION -> "GL_INVALID_OPERATION";
            case GL_INVALID_FRAMEBUFFER_OPERATION -> "GL_INVALID_FRAMEBUFFER_OPERATION";
            case GL_OUT_OF_MEMORY -> "GL_OUT_OF_MEMORY";
            default -> "0x" + Integer.toHexString(error);
        };
    }
}
