package org.cloudanchor.eng.ar;

/**
 * Opaque anchor handle owned by an {@link ArSession}.
 */
public interface ArAnchor {
}
