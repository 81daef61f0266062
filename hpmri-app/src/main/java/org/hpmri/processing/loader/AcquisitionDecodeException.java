package org.hpmri.processing.loader;

/**
 * This exception is thrown when an acquisition file exists but cannot be parsed.
 */
public class AcquisitionDecodeException
        extends AcquisitionException {

    public AcquisitionDecodeException(final String message) {
        super(message);
    }

    public AcquisitionDecodeException(final String message,
                                      final Throwable cause) {
        super(message, cause);
    }
}
