package org.cloudanchor.eng.ar;

import org.cloudanchor.eng.EngCfg;
import org.joml.*;
import org.tinylog.Logger;

import java.util.Locale;

public class PoseUtils {

    private static final Vector3fc LOCAL_UP = new Vector3f(0.0f, 1.0f, 0.0f);

    private PoseUtils() {
        // Utility class
    }

    /**
     * Signed distance from the camera to the plane along the plane normal. The plane pose must have its Y axis
     * parallel to the plane normal, as the plane center pose or a hit test pose do. Positive when the camera is on the
     * side the normal points to.
     */
    public static float calculateDistanceToPlane(ArSession session, ArPose planePose, ArPose cameraPose) {
        float[] planeRaw = new float[ArSession.POSE_RAW_SIZE];
        session.getPoseRaw(planePose, planeRaw);
        Vector3f normal = getPlaneNormal(session, planePose);

        float[] cameraRaw = new float[ArSession.POSE_RAW_SIZE];
        session.getPoseRaw(cameraPose, cameraRaw);
        Vector3f planeToCamera = new Vector3f(cameraRaw[4] - planeRaw[4], cameraRaw[5] - planeRaw[5],
                cameraRaw[6] - planeRaw[6]);
        return normal.dot(planeToCamera);
    }

    public static String formatMatrix(float[] rawMatrix) {
        if (rawMatrix == null || rawMatrix.length < ArSession.MATRIX_SIZE) {
            throw new IllegalArgumentException("A 4x4 matrix needs 16 values");
        }
        var sb = new StringBuilder();
        for (int row = 0; row < 4; row++) {
            if (row > 0) {
                sb.append('\n');
            }
            sb.append(String.format(Locale.ROOT, "%.6f, %.6f, %.6f, %.6f", rawMatrix[row], rawMatrix[row + 4],
                    rawMatrix[row + 8], rawMatrix[row + 12]));
        }
        return sb.toString();
    }

    /**
     * The normal of a plane, defined as the pose's local positive Y axis.
     */
    public static Vector3f getPlaneNormal(ArSession session, ArPose planePose) {
        float[] raw = new float[ArSession.POSE_RAW_SIZE];
        session.getPoseRaw(planePose, raw);
        Quaternionf rotation = new Quaternionf(raw[0], raw[1], raw[2], raw[3]);
        return rotation.transform(LOCAL_UP, new Vector3f());
    }

    public static void getTransformMatrixFromAnchor(ArSession session, ArAnchor anchor, Matrix4f outModelMatrix) {
        if (outModelMatrix == null) {
            Logger.error("Model matrix is null");
            return;
        }
        float[] rawMatrix = new float[ArSession.MATRIX_SIZE];
        try (var pose = new ScopedArPose(session)) {
            session.getAnchorPose(anchor, pose.getArPose());
            session.getPoseMatrix(pose.getArPose(), rawMatrix);
        }
        outModelMatrix.set(rawMatrix);
        if (EngCfg.getInstance().isLogMatrices()) {
            log4x4Matrix(rawMatrix);
        }
    }

    /**
     * Logs a column-major matrix, one row per line.
     */
    public static void log4x4Matrix(float[] rawMatrix) {
        Logger.info("Matrix:\n{}", formatMatrix(rawMatrix));
    }
}
