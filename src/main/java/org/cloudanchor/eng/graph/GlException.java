package org.cloudanchor.eng.graph;

/**
 * Fatal graphics state failure. Raised by the GL checks, not meant to be recovered from by the render loop.
 */
public class GlException extends RuntimeException {

    public GlException(String message) {
        super(message);
    }
}
