package org.hpmri.processing.loader;

/**
 * This exception is thrown when a requested frame or dataset index has no corresponding acquisition file.
 */
public class AcquisitionNotFoundException
        extends AcquisitionException {

    public enum Reason {
        /** index is negative or not less than the number of available files */
        INDEX_OUT_OF_RANGE,
        /** index is in range but the file derived from it does not exist */
        FILE_MISSING
    }

    private final Reason reason;

    public AcquisitionNotFoundException(final String message,
                                        final Reason reason) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
