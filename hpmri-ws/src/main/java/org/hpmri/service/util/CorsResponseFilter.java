package org.hpmri.service.util;

import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.core.MultivaluedMap;
import javax.ws.rs.ext.Provider;

/**
 * Adds permissive cross-origin headers to every response so that browser based viewers
 * served from other origins can call these APIs.
 */
@Provider
public class CorsResponseFilter
        implements ContainerResponseFilter {

    public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";

    @Override
    public void filter(final ContainerRequestContext requestContext,
                       final ContainerResponseContext responseContext) {
        final MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle(ALLOW_ORIGIN, "*");
        headers.putSingle(ALLOW_METHODS, "GET, POST, PUT, OPTIONS");
        headers.putSingle(ALLOW_HEADERS, "Content-Type, Accept, Origin");
    }
}
