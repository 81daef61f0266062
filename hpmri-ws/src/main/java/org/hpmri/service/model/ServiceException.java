package org.hpmri.service.model;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

/**
 * Base class for all HP-MRI web service exceptions.
 * The response carries the message as plain text.
 */
public class ServiceException
        extends WebApplicationException {

    private final String message;

    public ServiceException(final String message,
                            final Response.Status status) {
        this(message, status, null);
    }

    public ServiceException(final String message,
                            final Throwable cause) {
        this(message, Response.Status.INTERNAL_SERVER_ERROR, cause);
    }

    public ServiceException(final String message,
                            final Response.Status status,
                            final Throwable cause) {
        super(cause, getResponse(message, status));
        this.message = message;
    }

    @Override
    public String getMessage() {
        return message;
    }

    public static Response getResponse(final String message,
                                       final Response.Status status) {
        return Response.status(status).entity(message).type(MediaType.TEXT_PLAIN_TYPE).build();
    }
}
