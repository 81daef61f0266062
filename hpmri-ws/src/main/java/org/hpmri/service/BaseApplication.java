package org.hpmri.service;

import javax.ws.rs.ApplicationPath;
import javax.ws.rs.core.Application;

/**
 * Maps all requests "/*" to the jax-rs web services.
 */
@ApplicationPath("/")
public class BaseApplication extends Application {
}
