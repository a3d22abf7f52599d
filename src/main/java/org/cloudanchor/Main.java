package org.cloudanchor;

import com.beust.jcommander.*;
import org.cloudanchor.eng.EngCfg;
import org.cloudanchor.eng.assets.*;
import org.cloudanchor.eng.graph.*;
import org.cloudanchor.eng.scene.*;
import org.tinylog.Logger;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Inspects the assets the renderer loads: meshes and textures.
 */
public class Main {

    @Parameter(names = "-d", description = "Assets directory")
    private String assetsDir;

    @Parameter(names = "-m", description = "OBJ model to inspect, relative to the assets directory")
    private String modelPath;

    @Parameter(names = "-t", description = "PNG texture to inspect, relative to the assets directory")
    private String texturePath;

    public static void main(String[] args) {
        var main = new Main();
        var jCmd = JCommander.newBuilder().addObject(main).build();
        try {
            jCmd.parse(args);
            if (!main.run(System.out)) {
                System.exit(1);
            }
        } catch (ParameterException excp) {
            Logger.error(excp.getMessage());
            jCmd.usage();
        }
    }

    static String describeMesh(String name, MeshData meshData) {
        boolean hasNormals = false;
        for (float v : meshData.normals()) {
            if (v != 0.0f) {
                hasNormals = true;
                break;
            }
        }
        boolean hasUvs = false;
        for (float v : meshData.uvs()) {
            if (v != 0.0f) {
                hasUvs = true;
                break;
            }
        }
        return String.format(Locale.ROOT, "%s: vertices=%d triangles=%d normals=%s uvs=%s", name,
                meshData.getNumVertices(), meshData.getNumTriangles(), hasNormals, hasUvs);
    }

    boolean run(PrintStream out) {
        if (modelPath == null && texturePath == null) {
            throw new ParameterException("Either -m or -t must be provided");
        }
        String dir = assetsDir != null ? assetsDir : EngCfg.getInstance().getAssetsDir();
        AssetManager mgr = new DirAssetManager(Path.of(dir));
        boolean ok = true;

        if (modelPath != null) {
            Optional<MeshData> meshData = ObjLoader.loadObj(mgr, modelPath);
            if (meshData.isPresent()) {
                out.println(describeMesh(modelPath, meshData.get()));
            } else {
                out.println(modelPath + ": could not be loaded");
                ok = false;
            }
        }

        if (texturePath != null) {
            Optional<ImageData> imageData = AssetUtils.loadBytes(mgr, texturePath).flatMap(TextureLoader::decodePng);
            if (imageData.isPresent()) {
                try (ImageData image = imageData.get()) {
                    out.printf(Locale.ROOT, "%s: %dx%d%n", texturePath, image.getWidth(), image.getHeight());
                }
            } else {
                out.println(texturePath + ": could not be loaded");
                ok = false;
            }
        }
        return ok;
    }
}
