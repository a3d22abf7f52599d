package org.cloudanchor.eng.scene;

import org.cloudanchor.eng.assets.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ObjLoaderTest {

    private AssetManager mgr;

    private static void assertShape(MeshData meshData) {
        int numVertices = meshData.getNumVertices();
        assertEquals(0, meshData.vertices().length % 3);
        assertEquals(meshData.vertices().length, meshData.normals().length);
        assertEquals(numVertices * 2, meshData.uvs().length);
        assertEquals(0, meshData.indices().length % 3);
        for (int index : meshData.indices()) {
            assertTrue(index >= 0 && index < numVertices, "Index out of range: " + index);
        }
    }

    @BeforeEach
    void setUp() {
        mgr = new ClasspathAssetManager("assets");
    }

    @Test
    void loadsQuadAsTwoTriangles() {
        MeshData meshData = ObjLoader.loadObj(mgr, "models/quad.obj").orElseThrow();
        assertShape(meshData);
        assertEquals(2, meshData.getNumTriangles());
        assertTrue(meshData.getNumVertices() >= 4 && meshData.getNumVertices() <= 6);

        float[] normals = meshData.normals();
        for (int i = 0; i < normals.length; i += 3) {
            assertEquals(0.0f, normals[i], 1e-5f);
            assertEquals(1.0f, Math.abs(normals[i + 1]), 1e-5f);
            assertEquals(0.0f, normals[i + 2], 1e-5f);
        }
        float[] uvs = meshData.uvs();
        for (float uv : uvs) {
            assertTrue(uv >= 0.0f && uv <= 1.0f);
        }
    }

    @Test
    void mergesMeshesWithOffsetIndices() {
        MeshData meshData = ObjLoader.loadObj(mgr, "models/two_objects.obj").orElseThrow();
        assertShape(meshData);
        assertEquals(2, meshData.getNumTriangles());
        assertEquals(6, meshData.getNumVertices());

        Set<Integer> used = new HashSet<>();
        for (int index : meshData.indices()) {
            used.add(index);
        }
        assertEquals(Set.of(0, 1, 2, 3, 4, 5), used);
    }

    @Test
    void generatesMissingNormalsAndZeroUvs() {
        MeshData meshData = ObjLoader.loadObj(mgr, "models/no_normals.obj").orElseThrow();
        assertShape(meshData);
        assertEquals(1, meshData.getNumTriangles());

        float[] normals = meshData.normals();
        for (int i = 0; i < normals.length; i += 3) {
            float length = (float) Math.sqrt(normals[i] * normals[i] + normals[i + 1] * normals[i + 1] +
                    normals[i + 2] * normals[i + 2]);
            assertEquals(1.0f, length, 1e-4f);
        }
        for (float uv : meshData.uvs()) {
            assertEquals(0.0f, uv);
        }
    }

    @Test
    void missingFileIsEmpty() {
        assertTrue(ObjLoader.loadObj(mgr, "models/missing.obj").isEmpty());
    }

    @Test
    void emptyFileIsEmpty() {
        assertTrue(ObjLoader.loadObj(mgr, "models/empty.obj").isEmpty());
    }

    @Test
    void fileWithoutGeometryIsEmpty() {
        assertTrue(ObjLoader.loadObj(mgr, "models/not_a_model.obj").isEmpty());
    }

    private static void writeTriangles(Path file, int numTriangles) throws IOException {
        var sb = new StringBuilder();
        int numVertices = numTriangles * 3;
        for (int i = 0; i < numVertices; i++) {
            sb.append("v ").append(i).append(' ').append(i % 2).append(' ').append(i % 3).append('\n');
        }
        for (int i = 0; i < numTriangles; i++) {
            int first = i * 3 + 1;
            sb.append("f ").append(first).append(' ').append(first + 1).append(' ').append(first + 2).append('\n');
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
    }

    @Test
    void loadsModelAtVertexLimit(@TempDir Path tempDir) throws IOException {
        writeTriangles(tempDir.resolve("limit.obj"), ObjLoader.MAX_VERTICES / 3);
        MeshData meshData = ObjLoader.loadObj(new DirAssetManager(tempDir), "limit.obj").orElseThrow();
        assertEquals(ObjLoader.MAX_VERTICES, meshData.getNumVertices());
    }

    @Test
    void rejectsModelOverVertexLimit(@TempDir Path tempDir) throws IOException {
        writeTriangles(tempDir.resolve("over.obj"), ObjLoader.MAX_VERTICES / 3 + 1);
        assertTrue(ObjLoader.loadObj(new DirAssetManager(tempDir), "over.obj").isEmpty());
    }
}
