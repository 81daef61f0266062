package org.hpmri.service.util;

import org.hpmri.processing.AcquisitionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The acquisition dispatcher to be shared across all HP-MRI web service requests.
 */
public class SharedAcquisitionDispatcher {

    private static AcquisitionDispatcher sharedDispatcher;

    public static AcquisitionDispatcher getInstance() {
        if (sharedDispatcher == null) {
            setSharedDispatcher();
        }
        return sharedDispatcher;
    }

    private static synchronized void setSharedDispatcher() {
        if (sharedDispatcher == null) {
            final HpMriServerProperties serverProperties = HpMriServerProperties.getProperties();
            sharedDispatcher = AcquisitionDispatcher.build(serverProperties::getMagnetParameters,
                                                           serverProperties.buildSliceRenderer());
            LOG.info("setSharedDispatcher: exit, created dispatcher using {}", serverProperties.getFilePath());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SharedAcquisitionDispatcher.class);
}
