package org.cloudanchor.eng.ar;

/**
 * Opaque pose handle owned by an {@link ArSession}.
 */
public interface ArPose {
}
