package org.hpmri.service;

import com.google.common.collect.Maps;

import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import org.hpmri.service.util.HpMriServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.swagger.annotations.Api;
import io.swagger.annotations.ApiOperation;

/**
 * APIs for accessing HP-MRI service configuration.
 */
@Path("/")
@Api()
public class DeploymentConfigurationService {

    public static final String VERSION_INFO_RESOURCE = "hpmri-version.properties";

    private final HpMriServerProperties serverProperties;
    private Map<String, String> versionInfo;

    @SuppressWarnings("UnusedDeclaration")
    public DeploymentConfigurationService() {
        this(HpMriServerProperties.getProperties());
    }

    public DeploymentConfigurationService(final HpMriServerProperties serverProperties) {
        this.serverProperties = serverProperties;
        this.versionInfo = null;
    }

    @Path("v1/serverProperties")
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(
            tags = "Service Configuration APIs",
            value = "The configured properties for this HP-MRI server instance")
    public Map<String, String> getServerProperties() {
        return serverProperties.getAll();
    }

    @Path("v1/versionInfo")
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(
            tags = "Service Configuration APIs",
            value = "The build version information for deployed services")
    public Map<String, String> getVersionInfo() {

        if (versionInfo == null) {
            // version info is filtered into the resource by the maven build
            try (final InputStream infoStream = getClass().getClassLoader().getResourceAsStream(VERSION_INFO_RESOURCE)) {
                if (infoStream != null) {
                    final Properties p = new Properties();
                    p.load(infoStream);
                    versionInfo = Maps.fromProperties(p);
                    LOG.info("getVersionInfo: loaded version info");
                }
            } catch (final Throwable t) {
                LOG.warn("getVersionInfo: failed to load version info", t);
            }
        }

        return versionInfo;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentConfigurationService.class);
}
