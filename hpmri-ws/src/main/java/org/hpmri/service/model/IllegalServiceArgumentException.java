package org.hpmri.service.model;

import javax.ws.rs.core.Response;

/**
 * Thrown when a request is missing required information or names an unsupported backend.
 */
public class IllegalServiceArgumentException
        extends ServiceException {

    public IllegalServiceArgumentException(final String message) {
        super(message, Response.Status.BAD_REQUEST);
    }

    public IllegalServiceArgumentException(final String message,
                                           final Throwable cause) {
        super(message, Response.Status.BAD_REQUEST, cause);
    }
}
