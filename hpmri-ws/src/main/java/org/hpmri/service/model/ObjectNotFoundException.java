package org.hpmri.service.model;

import javax.ws.rs.core.Response;

/**
 * Thrown when a requested frame or dataset does not exist.
 */
public class ObjectNotFoundException
        extends ServiceException {

    public ObjectNotFoundException(final String message) {
        super(message, Response.Status.NOT_FOUND);
    }

    public ObjectNotFoundException(final String message,
                                   final Throwable cause) {
        super(message, Response.Status.NOT_FOUND, cause);
    }
}
