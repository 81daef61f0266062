package org.hpmri.service;

import java.io.File;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

import javax.ws.rs.Consumes;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.hpmri.service.model.IllegalServiceArgumentException;
import org.hpmri.service.util.HpMriServerProperties;
import org.hpmri.service.util.HpMriServiceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.swagger.annotations.Api;
import io.swagger.annotations.ApiOperation;
import io.swagger.annotations.ApiResponse;
import io.swagger.annotations.ApiResponses;

/**
 * API for storing raw acquisition files in the configured upload directory.
 */
@Path("/upload")
@Api(tags = {"Upload APIs"})
public class UploadService {

    public static final String STATUS_KEY = "status";
    public static final String SUCCESS_STATUS = "success";

    private final File uploadDirectory;

    @SuppressWarnings("UnusedDeclaration")
    public UploadService() {
        this(HpMriServerProperties.getProperties().getUploadDirectory());
    }

    public UploadService(final File uploadDirectory) {
        this.uploadDirectory = uploadDirectory;
    }

    @Path("{fileName}")
    @PUT
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(
            value = "Save an acquisition file",
            notes = "The file name is reduced to letters, digits, '.', '_' and '-' before the file is saved.")
    @ApiResponses(value = {
            @ApiResponse(code = 400, message = "File name has no safe characters")
    })
    public Map<String, String> uploadFile(@PathParam("fileName") final String fileName,
                                          final InputStream content) {

        LOG.info("uploadFile: entry, fileName={}", fileName);

        Map<String, String> result = null;
        try {
            final String safeName = getSafeFileName(fileName);
            if (safeName.isEmpty()) {
                throw new IllegalServiceArgumentException("file name '" + fileName + "' has no safe characters");
            }

            final File targetFile = new File(uploadDirectory, safeName);
            FileUtils.copyInputStreamToFile(content, targetFile);

            LOG.info("uploadFile: saved {} ({} bytes)", targetFile, targetFile.length());

            result = Collections.singletonMap(STATUS_KEY, SUCCESS_STATUS);
        } catch (final Throwable t) {
            HpMriServiceUtil.throwServiceException(t);
        }

        return result;
    }

    /**
     * @return base name of the specified path with whitespace converted to underscores,
     *         unsafe characters dropped, and leading dots or underscores removed
     *         (an empty string if nothing safe remains).
     */
    public static String getSafeFileName(final String fileName) {
        if (fileName == null) {
            return "";
        }
        final String baseName = FilenameUtils.getName(fileName.trim());
        final String safeName = baseName.replaceAll("\\s+", "_").replaceAll("[^A-Za-z0-9._-]", "");
        return safeName.replaceFirst("^[._]+", "");
    }

    private static final Logger LOG = LoggerFactory.getLogger(UploadService.class);
}
