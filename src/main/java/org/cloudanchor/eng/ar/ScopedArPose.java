package org.cloudanchor.eng.ar;

/**
 * A pose allocated from a session for the duration of a try-with-resources block. The wrapper exclusively owns the
 * pose and destroys it when closed. It is not copyable.
 */
public final class ScopedArPose implements AutoCloseable {

    private final ArSession session;
    private ArPose pose;

    public ScopedArPose(ArSession session) {
        this(session, null);
    }

    public ScopedArPose(ArSession session, float[] poseRaw) {
        this.session = session;
        pose = session.createPose(poseRaw);
    }

    @Override
    public void close() {
        if (pose != null) {
            session.destroyPose(pose);
            pose = null;
        }
    }

    public ArPose getArPose() {
        if (pose == null) {
            throw new IllegalStateException("Pose already destroyed");
        }
        return pose;
    }

    public boolean isClosed() {
        return pose == null;
    }
}
