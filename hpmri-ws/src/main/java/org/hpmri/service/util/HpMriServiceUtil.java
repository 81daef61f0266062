package org.hpmri.service.util;

import ij.process.ByteProcessor;

import javax.ws.rs.core.Response;

import org.hpmri.processing.loader.AcquisitionNotFoundException;
import org.hpmri.service.model.IllegalServiceArgumentException;
import org.hpmri.service.model.ObjectNotFoundException;
import org.hpmri.service.model.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared utility methods and constants for HP-MRI services.
 */
public class HpMriServiceUtil {

    public static final String IMAGE_PNG_MIME_TYPE = "image/png";

    /**
     * Logs the specified failure and rethrows it as a {@link ServiceException} with an appropriate status.
     *
     * @throws ServiceException
     *   always.
     */
    public static void throwServiceException(final Throwable t)
            throws ServiceException {

        if (t instanceof ServiceException) {
            LOG.error("service failure", t);
            throw (ServiceException) t;
        } else if (t instanceof AcquisitionNotFoundException) {
            final AcquisitionNotFoundException e = (AcquisitionNotFoundException) t;
            LOG.warn("acquisition not found ({}): {}", e.getReason(), e.getMessage());
            throw new ObjectNotFoundException(e.getMessage(), e);
        } else if (t instanceof IllegalArgumentException) {
            LOG.warn("invalid request: {}", t.getMessage());
            throw new IllegalServiceArgumentException(t.getMessage(), t);
        } else {
            LOG.error("service failure", t);
            throw new ServiceException(t.getMessage(), t);
        }
    }

    public static Response getPngResponse(final ByteProcessor slice) {
        return Response.ok(new ByteProcessorStreamingOutput(slice), IMAGE_PNG_MIME_TYPE).build();
    }

    private static final Logger LOG = LoggerFactory.getLogger(HpMriServiceUtil.class);
}
