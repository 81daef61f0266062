package org.hpmri.processing.loader;

/**
 * Base class for failures to locate or decode acquisition data.
 */
public class AcquisitionException
        extends RuntimeException {

    public AcquisitionException(final String message) {
        super(message);
    }

    public AcquisitionException(final String message,
                                final Throwable cause) {
        super(message, cause);
    }
}
