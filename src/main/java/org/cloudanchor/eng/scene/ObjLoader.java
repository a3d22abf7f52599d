package org.cloudanchor.eng.scene;

import org.cloudanchor.eng.assets.*;
import org.lwjgl.PointerBuffer;
import org.lwjgl.assimp.*;
import org.lwjgl.system.MemoryUtil;
import org.tinylog.Logger;

import java.nio.*;
import java.util.Optional;

import static org.lwjgl.assimp.Assimp.*;

public class ObjLoader {

    public static final int FLAGS = aiProcess_GenSmoothNormals | aiProcess_JoinIdenticalVertices |
            aiProcess_Triangulate | aiProcess_FixInfacingNormals;
    // Renderer index buffers are GL_UNSIGNED_SHORT
    public static final int MAX_VERTICES = 0xFFFF;

    private ObjLoader() {
        // Utility class
    }

    /**
     * Loads an OBJ asset into flat vertex, normal, uv and index arrays. All meshes in the file are merged.
     *
     * @param mgr      asset manager holding the model
     * @param fileName path of the OBJ file, relative to the assets root
     * @return the mesh arrays, or empty if the asset is missing, could not be parsed or is too large
     */
    public static Optional<MeshData> loadObj(AssetManager mgr, String fileName) {
        Logger.debug("Loading mesh data [{}]", fileName);
        Optional<byte[]> contents = AssetUtils.loadBytes(mgr, fileName);
        if (contents.isEmpty()) {
            return Optional.empty();
        }
        if (contents.get().length == 0) {
            Logger.error("Empty model file [{}]", fileName);
            return Optional.empty();
        }

        ByteBuffer buffer = MemoryUtil.memAlloc(contents.get().length);
        AIScene aiScene = null;
        try {
            buffer.put(contents.get()).flip();
            aiScene = aiImportFileFromMemory(buffer, FLAGS, "obj");
            if (aiScene == null) {
                Logger.error("Error loading model [{}]: {}", fileName, aiGetErrorString());
                return Optional.empty();
            }
            Optional<MeshData> meshData = processScene(aiScene, fileName);
            meshData.ifPresent(m -> Logger.debug("Loaded mesh data [{}], vertices: {}, triangles: {}", fileName,
                    m.getNumVertices(), m.getNumTriangles()));
            return meshData;
        } finally {
            if (aiScene != null) {
                aiReleaseImport(aiScene);
            }
            MemoryUtil.memFree(buffer);
        }
    }

    private static Optional<MeshData> processScene(AIScene aiScene, String fileName) {
        int numMeshes = aiScene.mNumMeshes();
        PointerBuffer aiMeshes = aiScene.mMeshes();
        int numVertices = 0;
        int numIndices = 0;
        for (int i = 0; i < numMeshes; i++) {
            AIMesh aiMesh = AIMesh.create(aiMeshes.get(i));
            numVertices += aiMesh.mNumVertices();
            numIndices += countTriangles(aiMesh) * 3;
        }
        if (numVertices == 0) {
            Logger.error("Model [{}] has no vertices", fileName);
            return Optional.empty();
        }
        if (numVertices > MAX_VERTICES) {
            Logger.error("Model [{}] has {} vertices, more than the {} supported", fileName, numVertices,
                    MAX_VERTICES);
            return Optional.empty();
        }

        var meshData = new MeshData(new float[numVertices * 3], new float[numVertices * 3], new float[numVertices * 2],
                new int[numIndices]);
        int baseVertex = 0;
        int indexPos = 0;
        for (int i = 0; i < numMeshes; i++) {
            AIMesh aiMesh = AIMesh.create(aiMeshes.get(i));
            processVertices(aiMesh, baseVertex, meshData);
            processTextCoords(aiMesh, baseVertex, meshData.uvs());
            indexPos = processIndices(aiMesh, baseVertex, meshData.indices(), indexPos);
            baseVertex += aiMesh.mNumVertices();
        }
        return Optional.of(meshData);
    }

    private static int countTriangles(AIMesh aiMesh) {
        int numTriangles = 0;
        AIFace.Buffer aiFaces = aiMesh.mFaces();
        for (int i = 0; i < aiMesh.mNumFaces(); i++) {
            if (aiFaces.get(i).mNumIndices() == 3) {
                numTriangles++;
            }
        }
        return numTriangles;
    }

    private static int processIndices(AIMesh aiMesh, int baseVertex, int[] indices, int indexPos) {
        int pos = indexPos;
        int numFaces = aiMesh.mNumFaces();
        AIFace.Buffer aiFaces = aiMesh.mFaces();
        for (int i = 0; i < numFaces; i++) {
            AIFace aiFace = aiFaces.get(i);
            // Points and lines survive triangulation, the renderer only draws triangles
            if (aiFace.mNumIndices() != 3) {
                continue;
            }
            IntBuffer buffer = aiFace.mIndices();
            while (buffer.remaining() > 0) {
                indices[pos++] = baseVertex + buffer.get();
            }
        }
        return pos;
    }

    private static void processTextCoords(AIMesh aiMesh, int baseVertex, float[] uvs) {
        // Zero filled when the file has no texture coordinates
        AIVector3D.Buffer aiTextCoords = aiMesh.mTextureCoords(0);
        if (aiTextCoords == null) {
            return;
        }
        int numVertices = aiMesh.mNumVertices();
        for (int i = 0; i < numVertices; i++) {
            AIVector3D textCoord = aiTextCoords.get(i);
            int pos = (baseVertex + i) * 2;
            uvs[pos] = textCoord.x();
            uvs[pos + 1] = textCoord.y();
        }
    }

    private static void processVertices(AIMesh aiMesh, int baseVertex, MeshData meshData) {
        float[] vertices = meshData.vertices();
        float[] normals = meshData.normals();
        int numVertices = aiMesh.mNumVertices();
        AIVector3D.Buffer aiVertices = aiMesh.mVertices();
        AIVector3D.Buffer aiNormals = aiMesh.mNormals();
        for (int i = 0; i < numVertices; i++) {
            int pos = (baseVertex + i) * 3;
            AIVector3D aiVertex = aiVertices.get(i);
            vertices[pos] = aiVertex.x();
            vertices[pos + 1] = aiVertex.y();
            vertices[pos + 2] = aiVertex.z();
            if (aiNormals != null) {
                AIVector3D aiNormal = aiNormals.get(i);
                normals[pos] = aiNormal.x();
                normals[pos + 1] = aiNormal.y();
                normals[pos + 2] = aiNormal.z();
            }
        }
    }
}
