package org.hpmri.service.util;

import java.lang.reflect.Proxy;

import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.core.MultivaluedHashMap;
import javax.ws.rs.core.MultivaluedMap;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CorsResponseFilter} class.
 */
public class CorsResponseFilterTest {

    @Test
    public void testFilter() {

        final MultivaluedMap<String, Object> headers = new MultivaluedHashMap<>();
        headers.putSingle(CorsResponseFilter.ALLOW_ORIGIN, "http://example.org");

        final ContainerResponseContext responseContext = (ContainerResponseContext) Proxy.newProxyInstance(
                getClass().getClassLoader(),
                new Class[] { ContainerResponseContext.class },
                (proxy, method, args) -> {
                    if ("getHeaders".equals(method.getName())) {
                        return headers;
                    }
                    throw new UnsupportedOperationException(method.getName());
                });

        new CorsResponseFilter().filter(null, responseContext);

        Assert.assertEquals("origin header should be replaced", "*", headers.getFirst(CorsResponseFilter.ALLOW_ORIGIN));
        Assert.assertEquals("origin header should have one value",
                            1, headers.get(CorsResponseFilter.ALLOW_ORIGIN).size());
        Assert.assertTrue("PUT should be allowed",
                          String.valueOf(headers.getFirst(CorsResponseFilter.ALLOW_METHODS)).contains("PUT"));
        Assert.assertNotNull("headers should be allowed", headers.getFirst(CorsResponseFilter.ALLOW_HEADERS));
    }
}
