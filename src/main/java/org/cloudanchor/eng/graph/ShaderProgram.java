package org.cloudanchor.eng.graph;

import org.cloudanchor.eng.assets.*;
import org.tinylog.Logger;

import java.util.Optional;

import static org.lwjgl.opengl.GL20.*;

public class ShaderProgram {

    private ShaderProgram() {
        // Utility class
    }

    /**
     * Builds a shader program from a vertex and a fragment shader stored as assets.
     *
     * @param mgr                    asset manager holding the shader sources
     * @param vertexShaderFileName   vertex shader asset
     * @param fragmentShaderFileName fragment shader asset
     * @return the program handle, or 0 if a source could not be loaded, compiled or linked
     * @throws GlException if the GL reports an error while attaching the shaders
     */
    public static int createProgram(AssetManager mgr, String vertexShaderFileName, String fragmentShaderFileName) {
        Optional<String> vertexSource = AssetUtils.loadTextFile(mgr, vertexShaderFileName);
        if (vertexSource.isEmpty()) {
            Logger.error("Failed to load vertex shader [{}]", vertexShaderFileName);
            return 0;
        }
        Optional<String> fragmentSource = AssetUtils.loadTextFile(mgr, fragmentShaderFileName);
        if (fragmentSource.isEmpty()) {
            Logger.error("Failed to load fragment shader [{}]", fragmentShaderFileName);
            return 0;
        }
        return createProgram(vertexSource.get(), fragmentSource.get());
    }

    public static int createProgram(String vertexSource, String fragmentSource) {
        int vertexShader = loadShader(GL_VERTEX_SHADER, vertexSource);
        if (vertexShader == 0) {
            return 0;
        }
        int fragmentShader = loadShader(GL_FRAGMENT_SHADER, fragmentSource);
        if (fragmentShader == 0) {
            glDeleteShader(vertexShader);
            return 0;
        }

        int program = glCreateProgram();
        if (program != 0) {
            glAttachShader(program, vertexShader);
            GlUtils.checkGlError("glAttachShader");
            glAttachShader(program, fragmentShader);
            GlUtils.checkGlError("glAttachShader");

            glLinkProgram(program);
            if (glGetProgrami(program, GL_LINK_STATUS) != GL_TRUE) {
                Logger.error("Could not link program: {}", glGetProgramInfoLog(program));
                glDeleteProgram(program);
                program = 0;
            } else {
                glDetachShader(program, vertexShader);
                glDetachShader(program, fragmentShader);
            }
        }
        glDeleteShader(vertexShader);
        glDeleteShader(fragmentShader);
        return program;
    }

    private static int loadShader(int shaderType, String source) {
        int shader = glCreateShader(shaderType);
        if (shader == 0) {
            Logger.error("Could not create shader of type [{}]", shaderType);
            return 0;
        }
        glShaderSource(shader, source);
        glCompileShader(shader);
        if (glGetShaderi(shader, GL_COMPILE_STATUS) == GL_FALSE) {
            Logger.error("Could not compile shader of type [{}]: {}", shaderType, glGetShaderInfoLog(shader));
            glDeleteShader(shader);
            return 0;
        }
        return shader;
    }
}
