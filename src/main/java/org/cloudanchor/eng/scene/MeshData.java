package org.cloudanchor.eng.scene;

/**
 * Flat, unindexed-by-attribute mesh arrays: one xyz position, one xyz normal and one uv per vertex, three indices
 * per triangle.
 */
public record MeshData(float[] vertices, float[] normals, float[] uvs, int[] indices) {

    public int getNumTriangles() {
        return indices.length / 3;
    }

    public int getNumVertices() {
        return vertices.length / 3;
    }
}
