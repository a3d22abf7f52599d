package org.cloudanchor.eng.ar;

/**
 * The calls into the AR tracking SDK session used by the rendering helpers. Raw poses are laid out as
 * {@code [qx, qy, qz, qw, tx, ty, tz]}; matrices are 4x4 column-major.
 */
public interface ArSession {

    int MATRIX_SIZE = 16;
    int POSE_RAW_SIZE = 7;

    /**
     * Allocates a pose. Every pose created must be released with {@link #destroyPose(ArPose)}.
     *
     * @param poseRaw initial raw pose, or null for the identity pose
     */
    ArPose createPose(float[] poseRaw);

    void destroyPose(ArPose pose);

    void getAnchorPose(ArAnchor anchor, ArPose outPose);

    void getPoseMatrix(ArPose pose, float[] outMatrix);

    void getPoseRaw(ArPose pose, float[] outPoseRaw);
}
